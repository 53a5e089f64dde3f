package tap.java.funder;

import tap.core.error.FailureKind;

/**
 * What the chain said about a submitted transaction.
 *
 * @param status CONFIRMED, FAILED or TIMEOUT
 * @param failureKind set for FAILED
 * @param detail chain-provided detail for FAILED
 */
public record Confirmation(ConfirmationStatus status, FailureKind failureKind, String detail) {

    public Confirmation {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == ConfirmationStatus.FAILED && failureKind == null) {
            throw new IllegalArgumentException("failureKind cannot be null for FAILED");
        }
    }

    public static Confirmation confirmed() {
        return new Confirmation(ConfirmationStatus.CONFIRMED, null, null);
    }

    public static Confirmation failed(FailureKind kind, String detail) {
        return new Confirmation(ConfirmationStatus.FAILED, kind, detail);
    }

    public static Confirmation timeout() {
        return new Confirmation(ConfirmationStatus.TIMEOUT, null, null);
    }
}
