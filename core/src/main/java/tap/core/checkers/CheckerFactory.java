package tap.core.checkers;

import tap.core.model.IdentityKind;
import tap.core.quota.QuotaStore;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds checkers and chains from configuration.
 *
 * Thread-safety: stateless.
 */
public final class CheckerFactory {

    private CheckerFactory() {
    }

    /**
     * @param config what to build
     * @param store quota store, required for QUOTA checks
     * @return a new checker
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static Checker create(CheckerConfig config, QuotaStore store) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        return switch (config.kind()) {
            case AMOUNT_BOUNDS -> new AmountBoundsChecker(config.minAmount(), config.maxAmount());
            case AUTH_TOKEN -> new AuthTokenChecker(config.values());
            case IP_BLOCKLIST -> new IpBlocklistChecker(config.values());
            case QUOTA -> new QuotaChecker(
                store,
                config.identityKind(),
                config.limit(),
                config.windowNanos()
            );
        };
    }

    /**
     * Builds a chain. Two quota checks on the same identity kind would
     * reserve against the same window twice, so that is refused.
     */
    public static CheckerChain chain(List<CheckerConfig> configs, QuotaStore store) {
        if (configs == null) throw new IllegalArgumentException("configs cannot be null");

        Set<IdentityKind> quotaKinds = EnumSet.noneOf(IdentityKind.class);
        List<Checker> checkers = new ArrayList<>(configs.size());
        for (CheckerConfig config : configs) {
            if (config.kind() == CheckerKind.QUOTA && !quotaKinds.add(config.identityKind())) {
                throw new IllegalArgumentException("duplicate quota checker for " + config.identityKind());
            }
            checkers.add(create(config, store));
        }
        return new CheckerChain(checkers, store);
    }
}
