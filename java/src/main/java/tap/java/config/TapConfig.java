package tap.java.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import tap.core.bypass.BypasserConfig;
import tap.core.bypass.BypasserKind;
import tap.core.checkers.CheckerConfig;
import tap.core.checkers.CheckerKind;
import tap.core.model.IdentityKind;
import tap.java.funder.FunderConfig;
import tap.java.funder.RetryPolicy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validated service configuration.
 *
 * @param funder funding account, confirmation timeout, retry policy
 * @param chainInitialBalance balance the local chain gives the funding account
 * @param checkers admission checks, in configuration order
 * @param bypassers bypass rules, in configuration order
 * @param reservationLease how long a reservation may stay pending
 * @param reapInterval how often idle quota windows are dropped
 * @param reconcileInterval how often ambiguous attempts are rechecked
 * @param storageDir journal directory, null for memory only
 * @param walRotateBytes WAL segment size
 * @param snapshotEveryOps journal writes between snapshots
 * @param workerThreads size of the request worker pool
 */
public record TapConfig(
    FunderConfig funder,
    long chainInitialBalance,
    List<CheckerConfig> checkers,
    List<BypasserConfig> bypassers,
    Duration reservationLease,
    Duration reapInterval,
    Duration reconcileInterval,
    Path storageDir,
    long walRotateBytes,
    int snapshotEveryOps,
    int workerThreads
) {
    public TapConfig {
        if (funder == null) throw new IllegalArgumentException("funder cannot be null");
        if (chainInitialBalance < 0) throw new IllegalArgumentException("chainInitialBalance must be >= 0");
        checkers = checkers == null ? List.of() : List.copyOf(checkers);
        bypassers = bypassers == null ? List.of() : List.copyOf(bypassers);
        requirePositive(reservationLease, "reservationLease");
        requirePositive(reapInterval, "reapInterval");
        requirePositive(reconcileInterval, "reconcileInterval");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryOps <= 0) throw new IllegalArgumentException("snapshotEveryOps must be > 0");
        if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be > 0");

        if (reservationLease.compareTo(funder.worstCaseFundingTime()) <= 0) {
            throw new IllegalArgumentException("reservationLease (" + reservationLease
                + ") must exceed the longest funding call (" + funder.worstCaseFundingTime() + ")");
        }

        Set<IdentityKind> quotaKinds = EnumSet.noneOf(IdentityKind.class);
        for (CheckerConfig checker : checkers) {
            if (checker.kind() == CheckerKind.QUOTA && !quotaKinds.add(checker.identityKind())) {
                throw new IllegalArgumentException("duplicate quota checker for " + checker.identityKind());
            }
        }
    }

    /**
     * Configuration used when no file is given: in-memory quota, amount
     * bounds and one receiver quota.
     */
    public static TapConfig defaults() {
        JsonTapConfig json = new JsonTapConfig();
        JsonTapConfig.Checker bounds = new JsonTapConfig.Checker();
        bounds.type = "AMOUNT_BOUNDS";
        bounds.minAmount = 1L;
        bounds.maxAmount = 100_000_000L;
        JsonTapConfig.Checker quota = new JsonTapConfig.Checker();
        quota.type = "QUOTA";
        quota.identity = "RECEIVER";
        quota.limit = 1_000_000_000L;
        quota.windowSeconds = 86_400L;
        json.checkers = List.of(bounds, quota);
        return fromJson(json);
    }

    /**
     * @throws IllegalArgumentException if the file is not valid JSON or fails validation
     * @throws UncheckedIOException if the file cannot be read
     */
    public static TapConfig fromJsonFile(Path path) {
        if (path == null) throw new IllegalArgumentException("path cannot be null");
        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            return fromJson(mapper.readValue(path.toFile(), JsonTapConfig.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load TapConfig from " + path, e);
        }
    }

    public static TapConfig fromJson(JsonTapConfig cfg) {
        if (cfg == null) throw new IllegalArgumentException("config cannot be null");
        if (cfg.funder == null || cfg.funder.retry == null || cfg.chain == null || cfg.quota == null
            || cfg.storage == null) {
            throw new IllegalArgumentException("funder, funder.retry, chain, quota and storage sections cannot be null");
        }

        JsonTapConfig.Retry r = cfg.funder.retry;
        RetryPolicy retry = new RetryPolicy(
            r.maxAttempts,
            Duration.ofMillis(r.initialBackoffMillis),
            Duration.ofMillis(r.maxBackoffMillis),
            r.multiplier,
            r.jitterFactor
        );
        FunderConfig funder = new FunderConfig(
            cfg.funder.fundingAccount,
            Duration.ofMillis(cfg.funder.confirmationTimeoutMillis),
            retry,
            Duration.ofSeconds(cfg.funder.transactionTtlSeconds)
        );

        List<CheckerConfig> checkers = new ArrayList<>();
        for (JsonTapConfig.Checker c : nullToEmpty(cfg.checkers)) {
            checkers.add(toChecker(c));
        }
        List<BypasserConfig> bypassers = new ArrayList<>();
        for (JsonTapConfig.Bypasser b : nullToEmpty(cfg.bypassers)) {
            bypassers.add(toBypasser(b));
        }

        return new TapConfig(
            funder,
            cfg.chain.initialBalance,
            checkers,
            bypassers,
            Duration.ofMillis(cfg.quota.reservationLeaseMillis),
            Duration.ofMillis(cfg.quota.reapIntervalMillis),
            Duration.ofMillis(cfg.reconcileIntervalMillis),
            cfg.storage.dir == null || cfg.storage.dir.isBlank() ? null : Path.of(cfg.storage.dir),
            cfg.storage.walRotateBytes,
            cfg.storage.snapshotEveryOps,
            cfg.workerThreads
        );
    }

    private static CheckerConfig toChecker(JsonTapConfig.Checker c) {
        CheckerKind kind = parseEnum(CheckerKind.class, c.type, "checker type");
        return switch (kind) {
            case AMOUNT_BOUNDS -> CheckerConfig.amountBounds(
                require(c.minAmount, "minAmount"), require(c.maxAmount, "maxAmount"));
            case AUTH_TOKEN -> CheckerConfig.authToken(nullToEmpty(c.tokens));
            case IP_BLOCKLIST -> CheckerConfig.ipBlocklist(require(c.cidrs, "cidrs"));
            case QUOTA -> CheckerConfig.quota(
                parseEnum(IdentityKind.class, c.identity, "quota identity"),
                require(c.limit, "limit"),
                Duration.ofSeconds(require(c.windowSeconds, "windowSeconds")).toNanos());
        };
    }

    private static BypasserConfig toBypasser(JsonTapConfig.Bypasser b) {
        BypasserKind kind = parseEnum(BypasserKind.class, b.type, "bypasser type");
        List<String> values = require(b.values, "values");
        return switch (kind) {
            case AUTH_TOKEN -> BypasserConfig.authToken(values);
            case IP_ALLOWLIST -> BypasserConfig.ipAllowlist(values);
            case RECEIVER_ALLOWLIST -> BypasserConfig.receiverAllowlist(values);
        };
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        if (value == null) throw new IllegalArgumentException(what + " cannot be null");
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + what + ": " + value, e);
        }
    }

    private static <T> T require(T value, String name) {
        if (value == null) throw new IllegalArgumentException(name + " cannot be null");
        return value;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
