package tap.core.error;

/**
 * A transaction was accepted but no confirmation arrived in time. It may still land.
 */
public class ConfirmationTimedOutException extends TapException {

    private final String txnRef;

    public ConfirmationTimedOutException(String txnRef) {
        super(ErrorCode.CONFIRMATION_TIMED_OUT, "no confirmation for " + txnRef + " before the deadline");
        this.txnRef = txnRef;
    }

    public String getTxnRef() {
        return txnRef;
    }
}
