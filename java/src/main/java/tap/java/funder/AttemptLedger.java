package tap.java.funder;

import tap.core.model.FundingAttempt;
import tap.core.model.AttemptStatus;
import tap.core.quota.ReservationToken;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight and ambiguous funding attempts.
 *
 * A request has at most one PENDING attempt at a time. Attempts that timed
 * out stay here, keyed by transaction reference, until the reconciler
 * settles them or their transaction expires.
 */
public final class AttemptLedger {
    private final Map<String, FundingAttempt> pendingByRequest = new ConcurrentHashMap<>();
    private final Map<String, AmbiguousAttempt> ambiguousByTxn = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the request already has a pending attempt
     */
    public void recordPending(FundingAttempt attempt) {
        if (attempt == null) throw new IllegalArgumentException("attempt cannot be null");
        if (attempt.status() != AttemptStatus.PENDING) {
            throw new IllegalArgumentException("attempt must be PENDING, was " + attempt.status());
        }
        FundingAttempt existing = pendingByRequest.putIfAbsent(attempt.requestId(), attempt);
        if (existing != null) {
            throw new IllegalStateException("request " + attempt.requestId()
                + " already has pending attempt " + existing.attemptNumber());
        }
    }

    /**
     * Clears the request's pending attempt after a definite outcome.
     */
    public void complete(String requestId) {
        pendingByRequest.remove(requestId);
    }

    /**
     * Moves the request's pending attempt to the ambiguous set.
     *
     * @param expirationTimestampSecs when the chain stops considering the transaction
     */
    public void markAmbiguous(FundingAttempt attempt, List<ReservationToken> reservations,
                              long expirationTimestampSecs) {
        pendingByRequest.remove(attempt.requestId());
        ambiguousByTxn.put(attempt.txnRef(), new AmbiguousAttempt(attempt, reservations, expirationTimestampSecs));
    }

    /**
     * @return ambiguous attempts, lowest sequence number first
     */
    public List<AmbiguousAttempt> ambiguous() {
        return ambiguousByTxn.values().stream()
            .sorted(Comparator.comparingLong(a -> a.attempt().sequenceNumber()))
            .toList();
    }

    /**
     * @return the removed attempt, or null if it was already settled
     */
    public AmbiguousAttempt settle(String txnRef) {
        return ambiguousByTxn.remove(txnRef);
    }

    public int pendingCount() {
        return pendingByRequest.size();
    }

    public int ambiguousCount() {
        return ambiguousByTxn.size();
    }
}
