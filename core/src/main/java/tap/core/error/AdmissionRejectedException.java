package tap.core.error;

import tap.core.model.RejectionReason;

/**
 * A bypass or check refused the request. Not retried by the service.
 */
public class AdmissionRejectedException extends TapException {

    private final RejectionReason reason;

    public AdmissionRejectedException(RejectionReason reason) {
        this(ErrorCode.ADMISSION_REJECTED, reason);
    }

    protected AdmissionRejectedException(ErrorCode errorCode, RejectionReason reason) {
        super(errorCode, reason.message());
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
