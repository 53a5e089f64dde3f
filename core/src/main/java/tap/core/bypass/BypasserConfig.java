package tap.core.bypass;

import tap.core.common.IpRangeSet;

import java.util.Collection;
import java.util.List;

/**
 * Configuration for one bypass rule.
 *
 * @param kind the rule
 * @param values credentials, CIDR ranges or receiver addresses depending on the kind
 */
public record BypasserConfig(BypasserKind kind, List<String> values) {

    public BypasserConfig {
        if (kind == null) throw new IllegalArgumentException("kind cannot be null");
        if (values == null) throw new IllegalArgumentException("values cannot be null");
        values = List.copyOf(values);
    }

    public static BypasserConfig authToken(Collection<String> tokens) {
        return of(BypasserKind.AUTH_TOKEN, tokens, "tokens");
    }

    /**
     * @throws IllegalArgumentException if any entry is not a literal CIDR block
     */
    public static BypasserConfig ipAllowlist(Collection<String> cidrs) {
        BypasserConfig config = of(BypasserKind.IP_ALLOWLIST, cidrs, "cidrs");
        IpRangeSet.of(config.values());
        return config;
    }

    public static BypasserConfig receiverAllowlist(Collection<String> receivers) {
        return of(BypasserKind.RECEIVER_ALLOWLIST, receivers, "receivers");
    }

    private static BypasserConfig of(BypasserKind kind, Collection<String> values, String name) {
        if (values == null) throw new IllegalArgumentException(name + " cannot be null");
        if (values.isEmpty()) throw new IllegalArgumentException(name + " cannot be empty");
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " cannot contain blank entries");
            }
        }
        return new BypasserConfig(kind, List.copyOf(values));
    }
}
