package tap.core.error;

import tap.core.model.RejectionReason;

/**
 * The identity used up its quota for the current window.
 */
public class QuotaExceededException extends AdmissionRejectedException {

    public QuotaExceededException(RejectionReason reason) {
        super(ErrorCode.QUOTA_EXCEEDED, reason);
    }

    /**
     * @return nanoseconds until the window rolls over
     */
    public long getRetryAfterNanos() {
        return getReason().retryAfterNanos();
    }
}
