package tap.core.model;

public enum AttemptStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    TIMED_OUT
}
