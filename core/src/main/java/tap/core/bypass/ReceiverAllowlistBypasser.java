package tap.core.bypass;

import tap.core.model.FundingRequest;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Receivers are compared case-insensitively; hex addresses are commonly
 * written in either case.
 */
public final class ReceiverAllowlistBypasser implements Bypasser {
    private final Set<String> receivers;

    public ReceiverAllowlistBypasser(Collection<String> receivers) {
        if (receivers == null) throw new IllegalArgumentException("receivers cannot be null");
        this.receivers = receivers.stream()
            .map(r -> r.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public BypassDecision evaluate(FundingRequest request) {
        String receiver = request.receiver().trim().toLowerCase(Locale.ROOT);
        return receivers.contains(receiver) ? BypassDecision.BYPASS : BypassDecision.NO_OPINION;
    }

    @Override
    public BypasserKind kind() {
        return BypasserKind.RECEIVER_ALLOWLIST;
    }
}
