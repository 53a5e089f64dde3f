package tap.java.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tap.core.model.Identity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class WalQuotaJournalTest {

    private static final long WINDOW = 60_000_000_000L;
    private static final Identity A = Identity.receiver("0xa");
    private static final Identity B = Identity.sourceIp("10.0.0.2");

    @TempDir
    Path dir;

    private WalQuotaJournal open(int snapshotEveryOps) {
        WalQuotaJournal journal = WalQuotaJournal.open(dir, 1 << 20, snapshotEveryOps);
        journal.recover();
        return journal;
    }

    private static long count(Path d) throws IOException {
        try (Stream<Path> files = Files.list(d)) {
            return files.count();
        }
    }

    @Test
    void testLatestRecordPerIdentitySurvivesRestart() {
        WalQuotaJournal journal = open(1_000);
        journal.record(A, 0L, WINDOW, 1);
        journal.record(A, 0L, WINDOW, 3);
        journal.record(B, 5L, WINDOW, 7);
        journal.close();

        Map<Identity, QuotaRecord> recovered = WalQuotaJournal.open(dir, 1 << 20, 1_000).recover();

        assertEquals(2, recovered.size());
        assertEquals(3, recovered.get(A).committed());
        assertEquals(7, recovered.get(B).committed());
        assertEquals(5L, recovered.get(B).windowStartNanos());
        assertEquals(WINDOW, recovered.get(B).windowNanos());
    }

    @Test
    void testForgetRemovesIdentity() {
        WalQuotaJournal journal = open(1_000);
        journal.record(A, 0L, WINDOW, 1);
        journal.record(B, 0L, WINDOW, 2);
        journal.forget(A);
        journal.close();

        Map<Identity, QuotaRecord> recovered = WalQuotaJournal.open(dir, 1 << 20, 1_000).recover();

        assertFalse(recovered.containsKey(A));
        assertTrue(recovered.containsKey(B));
    }

    @Test
    void testForgetOfUnknownIdentityWritesNothing() {
        WalQuotaJournal journal = open(1_000);
        long before = journal.lastLsn();

        journal.forget(A);

        assertEquals(before, journal.lastLsn());
        journal.close();
    }

    @Test
    void testSnapshotResetsWalAndKeepsState() throws IOException {
        WalQuotaJournal journal = open(3);
        journal.record(A, 0L, WINDOW, 1);
        journal.record(A, 0L, WINDOW, 2);
        journal.record(B, 0L, WINDOW, 4);
        journal.record(A, 0L, WINDOW, 5);
        journal.close();

        assertEquals(1, count(dir.resolve("snapshots")));
        Map<Identity, QuotaRecord> recovered = WalQuotaJournal.open(dir, 1 << 20, 3).recover();
        assertEquals(5, recovered.get(A).committed());
        assertEquals(4, recovered.get(B).committed());
    }

    @Test
    void testLsnContinuesAcrossRestart() {
        WalQuotaJournal journal = open(1_000);
        journal.record(A, 0L, WINDOW, 1);
        journal.record(A, 0L, WINDOW, 2);
        journal.close();

        WalQuotaJournal reopened = open(1_000);
        assertEquals(2, reopened.lastLsn());
        reopened.record(B, 0L, WINDOW, 1);
        assertEquals(3, reopened.lastLsn());
        reopened.close();
    }

    @Test
    void testWritesAfterTornTailAreRecovered() throws IOException {
        WalQuotaJournal journal = open(1_000);
        journal.record(A, 0L, WINDOW, 1);
        journal.close();

        Path segment = FileWal.segments(dir.resolve("wal")).get(0);
        Files.write(segment, new byte[] {0x01, 0x02, 0x03, 0x04}, StandardOpenOption.APPEND);

        WalQuotaJournal reopened = open(1_000);
        reopened.record(B, 0L, WINDOW, 9);
        reopened.close();

        Map<Identity, QuotaRecord> recovered = WalQuotaJournal.open(dir, 1 << 20, 1_000).recover();
        assertEquals(1, recovered.get(A).committed());
        assertEquals(9, recovered.get(B).committed(), "A record appended after a torn tail was lost");
    }
}
