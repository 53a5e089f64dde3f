package tap.java.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.model.Identity;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Journal backed by a {@link Wal} plus periodic {@link Snapshotter} snapshots.
 * <p>
 * Every write:
 *  1) assigns the next log sequence number,
 *  2) appends and fsyncs the framed record,
 *  3) updates the in-memory image used for snapshots,
 *  4) rotates the segment if needed,
 *  5) every {@code snapshotEveryOps} writes, snapshots the image and resets
 *     the WAL.
 * <p>
 * Recovery loads the latest snapshot and replays WAL records whose LSN is
 * above everything already applied, so a crash between a snapshot and the
 * following reset replays nothing twice. It ends with a snapshot and a WAL
 * reset, which drops any torn tail.
 * <p>
 * Thread-safety: all methods are synchronized. The journal is shared by every
 * identity, so durable writes are serialized across identities. The quota
 * engine only writes when a reservation is committed, held or released from
 * hold, never while admitting.
 */
public final class WalQuotaJournal implements QuotaJournal {
    private static final Logger log = LoggerFactory.getLogger(WalQuotaJournal.class);

    private final Wal wal;
    private final Snapshotter snapshots;
    private final int snapshotEveryOps;
    private final Map<Identity, QuotaRecord> image = new HashMap<>();
    private long lsn;
    private int sinceSnapshot;

    public WalQuotaJournal(Wal wal, Snapshotter snapshots, int snapshotEveryOps) {
        if (wal == null) throw new IllegalArgumentException("wal cannot be null");
        if (snapshots == null) throw new IllegalArgumentException("snapshots cannot be null");
        if (snapshotEveryOps <= 0) throw new IllegalArgumentException("snapshotEveryOps must be > 0");
        this.wal = wal;
        this.snapshots = snapshots;
        this.snapshotEveryOps = snapshotEveryOps;
    }

    /**
     * Opens a journal under {@code dir}, using {@code dir/wal} and
     * {@code dir/snapshots}.
     */
    public static WalQuotaJournal open(Path dir, long rotateBytes, int snapshotEveryOps) {
        if (dir == null) throw new IllegalArgumentException("dir cannot be null");
        return new WalQuotaJournal(
            new FileWal(dir.resolve("wal"), rotateBytes),
            new FileSnapshotter(dir.resolve("snapshots")),
            snapshotEveryOps
        );
    }

    @Override
    public synchronized Map<Identity, QuotaRecord> recover() {
        image.clear();
        lsn = 0;

        Snapshotter.LoadedSnapshot loaded = snapshots.loadLatest();
        if (loaded != null) {
            for (QuotaRecord r : loaded.records()) {
                image.put(r.identity(), r);
            }
            lsn = loaded.lsn();
        }
        int fromSnapshot = image.size();

        int replayed = 0;
        try (Wal.WalReader reader = wal.openReader()) {
            for (byte[] payload; (payload = reader.next()) != null; ) {
                QuotaRecord r = RecordCodec.decode(payload);
                if (r.lsn() <= lsn) {
                    continue;
                }
                apply(r);
                lsn = r.lsn();
                replayed++;
            }
        }

        // New appends must not land behind a torn tail, so start from a clean WAL
        snapshots.writeSnapshot(lsn, image.values());
        wal.reset();
        sinceSnapshot = 0;

        log.info("Quota journal recovered: {} identities from snapshot, {} WAL records replayed, lsn={}",
            fromSnapshot, replayed, lsn);
        return Map.copyOf(image);
    }

    @Override
    public synchronized void record(Identity identity, long windowStartNanos, long windowNanos, long committed) {
        write(QuotaRecord.of(identity, windowStartNanos, windowNanos, committed, lsn + 1));
    }

    @Override
    public synchronized void forget(Identity identity) {
        if (!image.containsKey(identity)) {
            return;
        }
        write(QuotaRecord.tombstone(identity, lsn + 1));
    }

    @Override
    public synchronized void close() {
        wal.close();
    }

    synchronized long lastLsn() {
        return lsn;
    }

    private void write(QuotaRecord record) {
        wal.append(RecordCodec.encode(record));
        lsn = record.lsn();
        apply(record);
        wal.rotateIfNeeded();

        if (++sinceSnapshot >= snapshotEveryOps) {
            String id = snapshots.writeSnapshot(lsn, image.values());
            wal.reset();
            sinceSnapshot = 0;
            log.debug("Quota snapshot {} written ({} identities)", id, image.size());
        }
    }

    private void apply(QuotaRecord record) {
        if (record.tombstone()) {
            image.remove(record.identity());
        } else {
            image.put(record.identity(), record);
        }
    }
}
