package tap.core.checkers;

import tap.core.common.IpRangeSet;
import tap.core.model.IdentityKind;

import java.util.Collection;
import java.util.List;

/**
 * Configuration for one admission check.
 *
 * Only the fields relevant to {@code kind} are meaningful; the others are
 * zero, null or empty.
 *
 * @param kind the check
 * @param minAmount smallest amount accepted (AMOUNT_BOUNDS)
 * @param maxAmount largest amount accepted (AMOUNT_BOUNDS)
 * @param values accepted tokens (AUTH_TOKEN) or blocked CIDR ranges (IP_BLOCKLIST)
 * @param identityKind what quota is accounted under (QUOTA)
 * @param limit ceiling per window (QUOTA)
 * @param windowNanos window length in nanoseconds (QUOTA)
 */
public record CheckerConfig(
    CheckerKind kind,
    long minAmount,
    long maxAmount,
    List<String> values,
    IdentityKind identityKind,
    long limit,
    long windowNanos
) {
    public CheckerConfig {
        if (kind == null) throw new IllegalArgumentException("kind cannot be null");
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * @param minAmount smallest amount accepted, inclusive
     * @param maxAmount largest amount accepted, inclusive
     * @return configuration for an amount bounds check
     */
    public static CheckerConfig amountBounds(long minAmount, long maxAmount) {
        if (minAmount <= 0) throw new IllegalArgumentException("minAmount must be > 0");
        if (maxAmount < minAmount) throw new IllegalArgumentException("maxAmount must be >= minAmount");

        return new CheckerConfig(CheckerKind.AMOUNT_BOUNDS, minAmount, maxAmount, List.of(), null, 0L, 0L);
    }

    /**
     * @param accepted accepted credentials; empty accepts any credential
     * @return configuration for a credential presence check
     */
    public static CheckerConfig authToken(Collection<String> accepted) {
        if (accepted == null) throw new IllegalArgumentException("accepted cannot be null");

        return new CheckerConfig(CheckerKind.AUTH_TOKEN, 0L, 0L, List.copyOf(accepted), null, 0L, 0L);
    }

    /**
     * @param cidrs blocked ranges
     * @return configuration for an IP blocklist check
     */
    public static CheckerConfig ipBlocklist(Collection<String> cidrs) {
        if (cidrs == null) throw new IllegalArgumentException("cidrs cannot be null");
        if (cidrs.isEmpty()) throw new IllegalArgumentException("cidrs cannot be empty");
        IpRangeSet.of(cidrs);

        return new CheckerConfig(CheckerKind.IP_BLOCKLIST, 0L, 0L, List.copyOf(cidrs), null, 0L, 0L);
    }

    /**
     * @param identityKind attribute quota is tracked under
     * @param limit maximum amount per window
     * @param windowNanos window length
     * @return configuration for a quota check
     */
    public static CheckerConfig quota(IdentityKind identityKind, long limit, long windowNanos) {
        if (identityKind == null) throw new IllegalArgumentException("identityKind cannot be null");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (windowNanos <= 0) throw new IllegalArgumentException("windowNanos must be > 0");

        return new CheckerConfig(CheckerKind.QUOTA, 0L, 0L, List.of(), identityKind, limit, windowNanos);
    }
}
