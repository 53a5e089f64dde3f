package tap.java.funder;

public enum ConfirmationStatus {
    CONFIRMED,
    FAILED,
    TIMEOUT
}
