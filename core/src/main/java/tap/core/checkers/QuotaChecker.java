package tap.core.checkers;

import tap.core.model.FundingRequest;
import tap.core.model.Identity;
import tap.core.model.IdentityKind;
import tap.core.model.RejectionReason;
import tap.core.model.RejectionReasonCode;
import tap.core.quota.QuotaStore;
import tap.core.quota.ReserveResult;

import java.util.Locale;

/**
 * Per-identity fixed-window quota backed by a {@link QuotaStore}.
 *
 * The admission decision and the reservation are one store call, so two
 * concurrent requests for the same identity cannot both squeeze under the
 * limit. The window follows the request's time, which keeps the checker
 * free of clocks; how long a reservation may stay pending is up to the store.
 */
public final class QuotaChecker implements Checker {
    private final QuotaStore store;
    private final IdentityKind identityKind;
    private final long limit;
    private final long windowNanos;

    public QuotaChecker(QuotaStore store, IdentityKind identityKind, long limit, long windowNanos) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (identityKind == null) throw new IllegalArgumentException("identityKind cannot be null");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (windowNanos <= 0) throw new IllegalArgumentException("windowNanos must be > 0");
        this.store = store;
        this.identityKind = identityKind;
        this.limit = limit;
        this.windowNanos = windowNanos;
    }

    @Override
    public CheckResult check(FundingRequest request, boolean dryRun) {
        Identity identity = identityKind.identify(request);
        if (identity == null) {
            return CheckResult.reject(RejectionReason.of(
                RejectionReasonCode.IDENTITY_UNAVAILABLE,
                "request carries no " + identityKind.name().toLowerCase(Locale.ROOT) + " to account quota against"));
        }

        long now = request.requestedAtNanos();
        ReserveResult result = dryRun
            ? store.peek(identity, request.amount(), limit, windowNanos, now)
            : store.checkAndReserve(identity, request.amount(), limit, windowNanos, now);

        if (!result.allowed()) {
            return CheckResult.reject(RejectionReason.quotaExceeded(
                "quota of " + limit + " exhausted for " + identity.key(), result.retryAfterNanos()));
        }
        return CheckResult.allow(result.token());
    }

    @Override
    public CheckerKind kind() {
        return CheckerKind.QUOTA;
    }

    public IdentityKind identityKind() {
        return identityKind;
    }

    public long limit() {
        return limit;
    }

    public long windowNanos() {
        return windowNanos;
    }
}
