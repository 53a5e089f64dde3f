package tap.java.funder;

/**
 * Counts from one reconciliation pass.
 *
 * @param confirmed attempts the chain confirmed
 * @param failed attempts the chain reported failed
 * @param expired attempts with no answer whose transaction has expired
 * @param stillPending attempts left for the next pass
 */
public record ReconcileReport(int confirmed, int failed, int expired, int stillPending) {

    public int examined() {
        return confirmed + failed + expired + stillPending;
    }
}
