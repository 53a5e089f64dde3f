package tap.core.checkers;

import tap.core.model.FundingRequest;

/**
 * One admission check.
 */
public interface Checker {

    /**
     * @param request the request
     * @param dryRun when true, answer without reserving anything
     * @return ALLOW, possibly carrying a reservation, or REJECT with a reason
     */
    CheckResult check(FundingRequest request, boolean dryRun);

    CheckerKind kind();
}
