package tap.java.funder;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Attempt budget and exponential backoff with jitter.
 *
 * @param maxAttempts total tries, including the first
 * @param initialBackoff delay before the second try
 * @param maxBackoff cap on any single delay
 * @param multiplier growth factor per try
 * @param jitterFactor fraction of the delay randomly added or removed, in [0, 1]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double multiplier,
    double jitterFactor
) {
    public RetryPolicy {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (jitterFactor < 0.0 || jitterFactor > 1.0) throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(5), 2.0, 0.1);
    }

    /**
     * Retries immediately. For tests.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * @param attempt the try that just failed, 1-based
     * @return how long to wait before the next one
     */
    public Duration backoff(int attempt) {
        long initial = initialBackoff.toNanos();
        if (initial == 0) {
            return Duration.ZERO;
        }
        double exponential = initial * Math.pow(multiplier, Math.max(0, attempt - 1));
        long base = Math.min((long) exponential, maxBackoff.toNanos());

        long jitter = (long) (base * jitterFactor * ThreadLocalRandom.current().nextDouble());
        if (ThreadLocalRandom.current().nextBoolean()) {
            return Duration.ofNanos(base + jitter);
        }
        return Duration.ofNanos(Math.max(initial, base - jitter));
    }

    /**
     * Longest possible sum of backoffs over the whole budget.
     */
    public Duration worstCaseBackoff() {
        Duration total = Duration.ZERO;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            double exponential = initialBackoff.toNanos() * Math.pow(multiplier, attempt - 1);
            long base = Math.min((long) exponential, maxBackoff.toNanos());
            total = total.plusNanos(base + (long) (base * jitterFactor));
        }
        return total;
    }
}
