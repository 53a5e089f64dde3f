package tap.java.storage;

import tap.core.error.StorageException;
import tap.core.model.Identity;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * One file per snapshot, named by the LSN it covers.
 * <p>
 * Format:
 *   int64 lsn
 *   int32 count
 *   repeated count times:
 *     - identity:    int32 len + UTF-8 bytes
 *     - windowStart: int64
 *     - windowNanos: int64
 *     - committed:   int64
 *     - lsn:         int64
 * <p>
 * Written to {@code snapshot-<lsn>.bin.tmp} and moved into place with
 * ATOMIC_MOVE. Older snapshots are deleted afterwards.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        if (dir == null) throw new IllegalArgumentException("dir cannot be null");
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(long lsn, Collection<QuotaRecord> records) {
        String name = String.format("%s%020d%s", PREFIX, lsn, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeLong(lsn);
            out.writeInt(records.size());
            for (QuotaRecord r : records) {
                writeString(out, r.identity().key());
                out.writeLong(r.windowStartNanos());
                out.writeLong(r.windowNanos());
                out.writeLong(r.committed());
                out.writeLong(r.lsn());
            }
        } catch (IOException e) {
            throw new StorageException("snapshot write failed", e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : snapshots()) {
                if (!old.equals(dst)) {
                    Files.deleteIfExists(old);
                }
            }
        } catch (IOException e) {
            throw new StorageException("snapshot publish failed", e);
        }
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            long lsn = in.readLong();
            int count = in.readInt();
            List<QuotaRecord> records = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                Identity identity = Identity.parse(readString(in));
                long windowStart = in.readLong();
                long windowNanos = in.readLong();
                long committed = in.readLong();
                long recordLsn = in.readLong();
                records.add(QuotaRecord.of(identity, windowStart, windowNanos, committed, recordLsn));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), lsn, records);
        } catch (IOException e) {
            throw new StorageException("snapshot read failed: " + snap, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                    String n = p.getFileName().toString();
                    return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                })
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list snapshot directory " + dir, e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        return new String(in.readNBytes(len), StandardCharsets.UTF_8);
    }
}
