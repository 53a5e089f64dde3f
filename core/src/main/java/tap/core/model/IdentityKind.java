package tap.core.model;

/**
 * Which attribute of a request a quota is tracked under.
 */
public enum IdentityKind {
    /** The address that receives the funds. */
    RECEIVER,

    /** The caller's IP address as seen by the transport. */
    SOURCE_IP,

    /** The credential presented with the request. */
    AUTH_TOKEN;

    /**
     * Derives the identity of this kind from a request.
     *
     * @param request the request
     * @return the identity, or null if the request does not carry this attribute
     */
    public Identity identify(FundingRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return switch (this) {
            case RECEIVER -> new Identity(this, request.receiver());
            case SOURCE_IP -> new Identity(this, request.sourceIp());
            case AUTH_TOKEN -> request.hasAuthToken() ? new Identity(this, request.authToken()) : null;
        };
    }
}
