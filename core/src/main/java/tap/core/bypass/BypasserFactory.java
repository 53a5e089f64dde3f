package tap.core.bypass;

import java.util.List;

/**
 * Builds bypass rules from configuration. Stateless.
 */
public final class BypasserFactory {

    private BypasserFactory() {
    }

    public static Bypasser create(BypasserConfig config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        return switch (config.kind()) {
            case AUTH_TOKEN -> new AuthTokenBypasser(config.values());
            case IP_ALLOWLIST -> new IpAllowlistBypasser(config.values());
            case RECEIVER_ALLOWLIST -> new ReceiverAllowlistBypasser(config.values());
        };
    }

    public static BypassEvaluator evaluator(List<BypasserConfig> configs) {
        if (configs == null) throw new IllegalArgumentException("configs cannot be null");
        return new BypassEvaluator(configs.stream().map(BypasserFactory::create).toList());
    }
}
