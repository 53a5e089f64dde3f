package tap.java.storage;

import java.util.Collection;
import java.util.List;

/**
 * Full copies of the journal state, used to bound recovery time.
 * <p>
 * On restart the latest snapshot is loaded, then WAL records with a higher
 * log sequence number are replayed on top.
 */
public interface Snapshotter {

    /**
     * Persist every live record.
     *
     * @param lsn highest log sequence number covered
     * @param records current state, one record per identity
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(long lsn, Collection<QuotaRecord> records);

    /**
     * @return latest snapshot, or null if none was written yet
     */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, long lsn, List<QuotaRecord> records) {}
}
