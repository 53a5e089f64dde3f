package tap.core.checkers;

import tap.core.model.FundingRequest;
import tap.core.quota.QuotaStore;
import tap.core.quota.ReservationToken;
import tap.core.quota.Resolution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs checkers in ascending {@link CheckerKind#cost()} and stops at the
 * first rejection.
 *
 * Reservations taken by checkers that passed before the rejecting one are
 * released before returning, so a rejected request leaves the quota store as
 * it found it. On admission the caller owns the returned reservations and must
 * resolve each of them.
 *
 * Thread-safety: immutable; concurrency is handled by the quota store.
 */
public final class CheckerChain {
    private final List<Checker> checkers;
    private final QuotaStore store;

    /**
     * @param checkers checks in configuration order; sorting is stable so
     *                 equal-cost checks keep this order
     * @param store store used to release reservations on rejection; may be
     *              null when no checker reserves quota
     */
    public CheckerChain(List<Checker> checkers, QuotaStore store) {
        if (checkers == null) throw new IllegalArgumentException("checkers cannot be null");
        List<Checker> sorted = new ArrayList<>(checkers);
        sorted.sort(Comparator.comparingInt(c -> c.kind().cost()));
        this.checkers = List.copyOf(sorted);
        this.store = store;
    }

    public Admission admit(FundingRequest request) {
        return run(request, false);
    }

    /**
     * Runs every check without reserving quota.
     */
    public Admission dryRun(FundingRequest request) {
        return run(request, true);
    }

    private Admission run(FundingRequest request, boolean dryRun) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");

        List<ReservationToken> taken = new ArrayList<>();
        try {
            for (Checker checker : checkers) {
                CheckResult result = checker.check(request, dryRun);
                if (!result.allowed()) {
                    releaseAll(taken);
                    taken.clear();
                    return Admission.reject(result.reason());
                }
                if (result.reservation() != null) {
                    taken.add(result.reservation());
                }
            }
        } catch (RuntimeException e) {
            releaseAll(taken);
            throw e;
        }
        return Admission.allow(taken);
    }

    /**
     * Releases reservations handed out by {@link #admit}.
     */
    public void releaseAll(List<ReservationToken> reservations) {
        if (reservations.isEmpty()) {
            return;
        }
        if (store == null) {
            throw new IllegalStateException("reservations present but chain has no quota store");
        }
        for (ReservationToken token : reservations) {
            store.resolve(token, Resolution.RELEASE);
        }
    }

    public List<Checker> checkers() {
        return checkers;
    }

    public static CheckerChain empty() {
        return new CheckerChain(List.of(), null);
    }
}
