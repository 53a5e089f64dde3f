package tap.java.config;

import java.util.List;

/**
 * Shape of the JSON configuration file. Bound by Jackson, validated by
 * {@link TapConfig#fromJson(JsonTapConfig)}. Missing fields keep the defaults
 * below.
 */
public class JsonTapConfig {
    public Funder funder = new Funder();
    public Chain chain = new Chain();
    public Quota quota = new Quota();
    public Storage storage = new Storage();
    public long reconcileIntervalMillis = 30_000;
    public int workerThreads = 16;
    public List<Checker> checkers = List.of();
    public List<Bypasser> bypassers = List.of();

    public static class Funder {
        public String fundingAccount = "0xfaucet";
        public long confirmationTimeoutMillis = 10_000;
        public long transactionTtlSeconds = 30;
        public Retry retry = new Retry();
    }

    public static class Retry {
        public int maxAttempts = 3;
        public long initialBackoffMillis = 200;
        public long maxBackoffMillis = 5_000;
        public double multiplier = 2.0;
        public double jitterFactor = 0.1;
    }

    public static class Chain {
        public long initialBalance = 1_000_000_000_000L;
    }

    public static class Quota {
        public long reservationLeaseMillis = 120_000;
        public long reapIntervalMillis = 60_000;
    }

    public static class Storage {
        /** Null keeps quota state in memory only. */
        public String dir;
        public long walRotateBytes = 64L * 1024 * 1024;
        public int snapshotEveryOps = 10_000;
    }

    public static class Checker {
        public String type;
        public Long minAmount;
        public Long maxAmount;
        public List<String> tokens;
        public List<String> cidrs;
        public String identity;
        public Long limit;
        public Long windowSeconds;
    }

    public static class Bypasser {
        public String type;
        public List<String> values;
    }
}
