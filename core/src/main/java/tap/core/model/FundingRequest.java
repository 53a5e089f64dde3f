package tap.core.model;

/**
 * A request to receive {@code amount} tokens at {@code receiver}. Immutable.
 *
 * @param receiver address that receives the funds
 * @param sourceIp caller address as reported by the transport
 * @param amount requested amount, always positive
 * @param authToken optional credential, null when absent
 * @param requestedAtNanos time the request was received
 */
public record FundingRequest(
    String receiver,
    String sourceIp,
    long amount,
    String authToken,
    long requestedAtNanos
) {
    public FundingRequest {
        if (receiver == null || receiver.isBlank()) {
            throw new IllegalArgumentException("receiver cannot be blank");
        }
        if (sourceIp == null || sourceIp.isBlank()) {
            throw new IllegalArgumentException("sourceIp cannot be blank");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        if (authToken != null && authToken.isBlank()) {
            authToken = null;
        }
    }

    public static FundingRequest of(String receiver, String sourceIp, long amount, long requestedAtNanos) {
        return new FundingRequest(receiver, sourceIp, amount, null, requestedAtNanos);
    }

    public FundingRequest withAuthToken(String token) {
        return new FundingRequest(receiver, sourceIp, amount, token, requestedAtNanos);
    }

    public boolean hasAuthToken() {
        return authToken != null;
    }
}
