package tap.java.funder;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testBackoffGrowsAndIsCapped() {
        RetryPolicy policy = new RetryPolicy(6, Duration.ofMillis(100), Duration.ofMillis(500), 2.0, 0.0);

        assertEquals(Duration.ofMillis(100), policy.backoff(1));
        assertEquals(Duration.ofMillis(200), policy.backoff(2));
        assertEquals(Duration.ofMillis(400), policy.backoff(3));
        assertEquals(Duration.ofMillis(500), policy.backoff(4));
        assertEquals(Duration.ofMillis(500), policy.backoff(5));
    }

    @Test
    void testJitterStaysInBounds() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 0.5);

        for (int i = 0; i < 200; i++) {
            long millis = policy.backoff(2).toMillis();
            assertTrue(millis >= 100 && millis <= 300, "Backoff out of bounds: " + millis);
        }
    }

    @Test
    void testWorstCaseBackoffCoversEveryRetry() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 0.5);

        // (100 + 50) + (200 + 100)
        assertEquals(Duration.ofMillis(450), policy.worstCaseBackoff());
        assertEquals(Duration.ZERO, RetryPolicy.immediate(5).worstCaseBackoff());
    }

    @Test
    void testWorstCaseFundingTime() {
        FunderConfig config = new FunderConfig("0xf", Duration.ofSeconds(10),
            new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 0.0), Duration.ofSeconds(30));

        assertEquals(Duration.ofMillis(30_300), config.worstCaseFundingTime());
    }

    @Test
    void testInvalidPolicies() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.5, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, 1.5));
    }
}
