package tap.core.quota;

/**
 * How a reservation ends.
 */
public enum Resolution {
    /** Quota is permanently consumed. */
    COMMIT,

    /** Quota is returned to the window it came from, if that window is still current. */
    RELEASE,

    /** Outcome unknown: keep the quota consumed, drop the lease, decide later. */
    HOLD
}
