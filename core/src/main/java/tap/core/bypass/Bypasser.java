package tap.core.bypass;

import tap.core.model.FundingRequest;

/**
 * Rule that can admit a request without running any checker.
 * Implementations are pure and thread-safe.
 */
public interface Bypasser {

    BypassDecision evaluate(FundingRequest request);

    BypasserKind kind();
}
