package tap.java.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tap.core.model.Identity;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileWalTest {

    @TempDir
    Path dir;

    private static byte[] record(String receiver, long committed, long lsn) {
        return RecordCodec.encode(QuotaRecord.of(Identity.receiver(receiver), 0L, 60L, committed, lsn));
    }

    private static List<QuotaRecord> readAll(Wal wal) {
        List<QuotaRecord> out = new ArrayList<>();
        try (Wal.WalReader reader = wal.openReader()) {
            for (byte[] payload; (payload = reader.next()) != null; ) {
                out.add(RecordCodec.decode(payload));
            }
        }
        return out;
    }

    // ========== APPEND / READ ==========

    @Test
    void testRecordsReadBackInOrderAcrossSegments() {
        FileWal wal = new FileWal(dir, 64);
        for (int i = 1; i <= 10; i++) {
            wal.append(record("0x" + i, i, i));
            wal.rotateIfNeeded();
        }

        assertTrue(FileWal.segments(dir).size() > 1, "Small rotate size should produce several segments");
        List<QuotaRecord> records = readAll(wal);
        assertEquals(10, records.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i + 1, records.get(i).lsn());
            assertEquals(Identity.receiver("0x" + (i + 1)), records.get(i).identity());
        }
        wal.close();
    }

    @Test
    void testReopenAppendsToNewestSegment() {
        FileWal first = new FileWal(dir, 1 << 20);
        first.append(record("0xa", 1, 1));
        first.close();

        FileWal second = new FileWal(dir, 1 << 20);
        second.append(record("0xb", 2, 2));

        assertEquals(1, FileWal.segments(dir).size());
        assertEquals(2, readAll(second).size());
        second.close();
    }

    @Test
    void testResetDropsEverySegment() {
        FileWal wal = new FileWal(dir, 32);
        for (int i = 1; i <= 5; i++) {
            wal.append(record("0xa", i, i));
            wal.rotateIfNeeded();
        }

        wal.reset();

        assertEquals(1, FileWal.segments(dir).size());
        assertTrue(readAll(wal).isEmpty());
        wal.append(record("0xa", 6, 6));
        assertEquals(6, readAll(wal).get(0).lsn());
        wal.close();
    }

    // ========== TORN AND CORRUPT TAILS ==========

    @Test
    void testTornPayloadStopsReplay() throws IOException {
        FileWal wal = new FileWal(dir, 1 << 20);
        wal.append(record("0xa", 1, 1));
        wal.append(record("0xb", 2, 2));
        wal.close();

        Path segment = FileWal.segments(dir).get(0);
        try (FileChannel ch = FileChannel.open(segment, StandardOpenOption.WRITE)) {
            ch.truncate(ch.size() - 3);
        }

        List<QuotaRecord> records = readAll(new FileWal(dir, 1 << 20));
        assertEquals(1, records.size());
        assertEquals(1, records.get(0).lsn());
    }

    @Test
    void testTornHeaderStopsReplay() throws IOException {
        FileWal wal = new FileWal(dir, 1 << 20);
        wal.append(record("0xa", 1, 1));
        wal.close();

        Path segment = FileWal.segments(dir).get(0);
        Files.write(segment, new byte[] {0x11, 0x22, 0x33}, StandardOpenOption.APPEND);

        assertEquals(1, readAll(new FileWal(dir, 1 << 20)).size());
    }

    @Test
    void testCrcMismatchStopsReplay() throws IOException {
        FileWal wal = new FileWal(dir, 1 << 20);
        wal.append(record("0xa", 1, 1));
        wal.append(record("0xb", 2, 2));
        wal.append(record("0xc", 3, 3));
        wal.close();

        Path segment = FileWal.segments(dir).get(0);
        byte[] bytes = Files.readAllBytes(segment);
        int second = record("0xa", 1, 1).length;
        // Flip a payload byte of the second record
        bytes[second + RecordCodec.HEADER_BYTES + 2] ^= 0x5A;
        Files.write(segment, bytes);

        List<QuotaRecord> records = readAll(new FileWal(dir, 1 << 20));
        assertEquals(1, records.size(), "Nothing after a corrupt record may be trusted");
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new FileWal(null, 10));
        assertThrows(IllegalArgumentException.class, () -> new FileWal(dir, 0));
    }
}
