package tap.java.storage;

/**
 * Write-ahead log for quota records.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated
 *    as absent during recovery (the reader stops at the first corrupt or
 *    truncated record).
 *  - append() fsyncs before returning.
 *  - I/O failures surface as {@link tap.core.error.StorageException}.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param serializedRecord header+payload bytes from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate to a new segment if the current one is over its size threshold.
     */
    void rotateIfNeeded();

    /**
     * Drop every segment and start an empty one. Called once a snapshot
     * covers everything in the log.
     */
    void reset();

    /**
     * Open a sequential reader over all segments, oldest first.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (header stripped), or null at the end of
         *         the log or at the first torn/corrupt record
         */
        byte[] next();

        @Override
        void close();
    }
}
