package tap.core.quota;

import tap.core.model.Identity;

/**
 * Handle on one provisional increment of a quota window.
 *
 * @param identity identity the amount was reserved under
 * @param id store-assigned id, unique per store
 * @param amount reserved amount
 * @param windowStartNanos start of the window the amount was taken from
 */
public record ReservationToken(Identity identity, long id, long amount, long windowStartNanos) {
    public ReservationToken {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
    }
}
