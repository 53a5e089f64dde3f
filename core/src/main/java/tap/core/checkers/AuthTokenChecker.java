package tap.core.checkers;

import tap.core.model.FundingRequest;
import tap.core.model.RejectionReason;
import tap.core.model.RejectionReasonCode;

import java.util.Collection;
import java.util.Set;

/**
 * Requires a credential. With an empty accepted set, any credential passes.
 */
public final class AuthTokenChecker implements Checker {
    private final Set<String> accepted;

    public AuthTokenChecker(Collection<String> accepted) {
        if (accepted == null) throw new IllegalArgumentException("accepted cannot be null");
        this.accepted = Set.copyOf(accepted);
    }

    @Override
    public CheckResult check(FundingRequest request, boolean dryRun) {
        if (!request.hasAuthToken()) {
            return CheckResult.reject(RejectionReason.of(
                RejectionReasonCode.AUTH_TOKEN_INVALID, "an auth token is required"));
        }
        if (!accepted.isEmpty() && !accepted.contains(request.authToken())) {
            return CheckResult.reject(RejectionReason.of(
                RejectionReasonCode.AUTH_TOKEN_INVALID, "auth token is not recognised"));
        }
        return CheckResult.allow();
    }

    @Override
    public CheckerKind kind() {
        return CheckerKind.AUTH_TOKEN;
    }
}
