package tap.core.model;

import java.util.Locale;

/**
 * Key under which quota is accounted. The kind is part of the key, so an IP
 * address and a receiver address with the same text never share a window.
 *
 * @param kind attribute the value was taken from
 * @param value the attribute value
 */
public record Identity(IdentityKind kind, String value) {

    public Identity {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be blank");
        }
    }

    public static Identity receiver(String address) {
        return new Identity(IdentityKind.RECEIVER, address);
    }

    public static Identity sourceIp(String ip) {
        return new Identity(IdentityKind.SOURCE_IP, ip);
    }

    /**
     * Stable string form used by the journal, e.g. {@code receiver:0xabc}.
     */
    public String key() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value;
    }

    /**
     * Inverse of {@link #key()}.
     */
    public static Identity parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        int colon = key.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("not an identity key: " + key);
        }
        IdentityKind kind = IdentityKind.valueOf(key.substring(0, colon).toUpperCase(Locale.ROOT));
        return new Identity(kind, key.substring(colon + 1));
    }

    @Override
    public String toString() {
        return key();
    }
}
