package tap.java.storage;

import tap.core.error.StorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ({@code 00000001.log}, {@code 00000002.log}, ...).
 * <p>
 *  - On construction it creates the directory if needed and opens the newest
 *    segment for append.
 *  - append() writes and calls force(true).
 *  - rotateIfNeeded() opens the next segment once the current one reaches
 *    {@code rotateBytes}.
 *  - The reader walks every segment in order and stops for good at the first
 *    truncated header, truncated payload or CRC mismatch.
 */
public class FileWal implements Wal {
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (dir == null) throw new IllegalArgumentException("dir cannot be null");
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StorageException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed", e);
        }
    }

    @Override
    public synchronized void reset() {
        try {
            ch.close();
            long next = segmentIndex(current) + 1;
            for (Path segment : segments(dir)) {
                Files.deleteIfExists(segment);
            }
            current = dir.resolve(segmentName(next));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StorageException("WAL reset failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> all = segments(dir);
        current = all.isEmpty() ? dir.resolve(segmentName(1)) : all.get(all.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StorageException("cannot open WAL segment " + current, e);
        }
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list WAL directory " + dir, e);
        }
    }

    private static String segmentName(long index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static long segmentIndex(Path segment) {
        String name = segment.getFileName().toString();
        return Long.parseLong(name.substring(0, name.length() - SUFFIX.length()));
    }

    /**
     * Sequential reader across segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> remaining;
        private FileChannel ch;
        private long pos;
        private boolean done;

        Reader(List<Path> segments) {
            this.remaining = new ArrayList<>(segments);
        }

        @Override
        public byte[] next() {
            if (done) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (remaining.isEmpty()) {
                            done = true;
                            return null;
                        }
                        ch = FileChannel.open(remaining.remove(0), READ);
                        pos = 0;
                    }
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] payload = readRecord();
                    if (payload == null) {
                        done = true;
                    }
                    return payload;
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private byte[] readRecord() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < RecordCodec.HEADER_BYTES) return null; // torn header
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
            if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // torn payload
            ByteBuffer payload = ByteBuffer.allocate(len);
            while (payload.hasRemaining()) {
                if (ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position()) < 0) return null;
            }
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) return null;
            pos += RecordCodec.HEADER_BYTES + len;
            return bytes;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
