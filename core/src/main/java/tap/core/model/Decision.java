package tap.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
