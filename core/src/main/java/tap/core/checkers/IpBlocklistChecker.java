package tap.core.checkers;

import tap.core.common.IpRangeSet;
import tap.core.model.FundingRequest;
import tap.core.model.RejectionReason;
import tap.core.model.RejectionReasonCode;

import java.util.Collection;

public final class IpBlocklistChecker implements Checker {
    private final IpRangeSet blocked;

    public IpBlocklistChecker(Collection<String> cidrs) {
        this.blocked = IpRangeSet.of(cidrs);
    }

    @Override
    public CheckResult check(FundingRequest request, boolean dryRun) {
        if (blocked.contains(request.sourceIp())) {
            return CheckResult.reject(RejectionReason.of(
                RejectionReasonCode.IP_BLOCKED, "source address " + request.sourceIp() + " is blocked"));
        }
        return CheckResult.allow();
    }

    @Override
    public CheckerKind kind() {
        return CheckerKind.IP_BLOCKLIST;
    }
}
