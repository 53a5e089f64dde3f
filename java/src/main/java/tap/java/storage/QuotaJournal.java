package tap.java.storage;

import tap.core.model.Identity;

import java.util.Map;

/**
 * Durable log of committed quota state, one live record per identity.
 */
public interface QuotaJournal extends AutoCloseable {

    /**
     * Journal that keeps nothing. Used when the quota store runs in memory.
     */
    QuotaJournal NOOP = new QuotaJournal() {
        @Override
        public Map<Identity, QuotaRecord> recover() {
            return Map.of();
        }

        @Override
        public void record(Identity identity, long windowStartNanos, long windowNanos, long committed) {
        }

        @Override
        public void forget(Identity identity) {
        }

        @Override
        public void close() {
        }
    };

    /**
     * Loads the latest state. Called once, before any write.
     *
     * @return newest record per identity
     */
    Map<Identity, QuotaRecord> recover();

    /**
     * Makes the identity's committed amount durable before returning.
     */
    void record(Identity identity, long windowStartNanos, long windowNanos, long committed);

    /**
     * Drops the identity.
     */
    void forget(Identity identity);

    @Override
    void close();
}
