package tap.java.storage;

import tap.core.model.Identity;

/**
 * Durable state of one identity's window.
 *
 * @param identity the identity
 * @param windowStartNanos start of the window
 * @param windowNanos window length
 * @param committed amount committed or held in the window
 * @param tombstone true if the identity was dropped
 * @param lsn log sequence number, strictly increasing per journal
 */
public record QuotaRecord(
    Identity identity,
    long windowStartNanos,
    long windowNanos,
    long committed,
    boolean tombstone,
    long lsn
) {
    public QuotaRecord {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
    }

    public static QuotaRecord of(Identity identity, long windowStartNanos, long windowNanos, long committed,
                                 long lsn) {
        return new QuotaRecord(identity, windowStartNanos, windowNanos, committed, false, lsn);
    }

    public static QuotaRecord tombstone(Identity identity, long lsn) {
        return new QuotaRecord(identity, 0L, 0L, 0L, true, lsn);
    }
}
