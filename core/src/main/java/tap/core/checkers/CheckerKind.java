package tap.core.checkers;

/**
 * Supported admission checks, with the relative cost used to order them.
 * Cheap checks run first so a malformed request never reaches the quota store.
 */
public enum CheckerKind {
    AMOUNT_BOUNDS(10),
    AUTH_TOKEN(20),
    IP_BLOCKLIST(30),
    QUOTA(100);

    private final int cost;

    CheckerKind(int cost) {
        this.cost = cost;
    }

    public int cost() {
        return cost;
    }
}
