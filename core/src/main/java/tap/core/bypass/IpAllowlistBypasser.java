package tap.core.bypass;

import tap.core.common.IpRangeSet;
import tap.core.model.FundingRequest;

import java.util.Collection;

public final class IpAllowlistBypasser implements Bypasser {
    private final IpRangeSet ranges;

    public IpAllowlistBypasser(Collection<String> cidrs) {
        this.ranges = IpRangeSet.of(cidrs);
    }

    @Override
    public BypassDecision evaluate(FundingRequest request) {
        return ranges.contains(request.sourceIp()) ? BypassDecision.BYPASS : BypassDecision.NO_OPINION;
    }

    @Override
    public BypasserKind kind() {
        return BypasserKind.IP_ALLOWLIST;
    }
}
