package tap.core.common;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * A CIDR block such as {@code 10.0.0.0/8} or {@code 2001:db8::/32}. A bare
 * address is a block of one.
 */
public final class IpRange {

    private final byte[] network;
    private final int prefixLength;
    private final String text;

    private IpRange(byte[] network, int prefixLength, String text) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.text = text;
    }

    /**
     * Parses CIDR notation. Only literal addresses are accepted; host names are
     * rejected rather than resolved.
     *
     * @param cidr e.g. {@code 192.168.0.0/16}
     * @return the range
     * @throws IllegalArgumentException if the text is not a valid literal block
     */
    public static IpRange parse(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            throw new IllegalArgumentException("cidr cannot be blank");
        }
        String trimmed = cidr.trim();
        int slash = trimmed.indexOf('/');
        String address = slash < 0 ? trimmed : trimmed.substring(0, slash);

        byte[] bytes = parseLiteral(address);
        if (bytes == null) {
            throw new IllegalArgumentException("not an IP literal: " + cidr);
        }

        int maxPrefix = bytes.length * 8;
        int prefix = maxPrefix;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(trimmed.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("bad prefix length in " + cidr, e);
            }
            if (prefix < 0 || prefix > maxPrefix) {
                throw new IllegalArgumentException("prefix length out of range in " + cidr);
            }
        }
        return new IpRange(mask(bytes, prefix), prefix, trimmed);
    }

    /**
     * @param ip literal address
     * @return true if the address lies in this block; false for anything unparseable
     */
    public boolean contains(String ip) {
        byte[] candidate = parseLiteral(ip);
        if (candidate == null || candidate.length != network.length) {
            return false;
        }
        byte[] masked = mask(candidate, prefixLength);
        for (int i = 0; i < network.length; i++) {
            if (masked[i] != network[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return text;
    }

    private static byte[] mask(byte[] address, int prefix) {
        byte[] out = address.clone();
        for (int i = 0; i < out.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            int byteMask = bitsInByte == 0 ? 0 : (0xFF << (8 - bitsInByte)) & 0xFF;
            out[i] = (byte) (out[i] & byteMask);
        }
        return out;
    }

    /**
     * InetAddress.getByName does not touch DNS for literals; anything that
     * does not look like one is refused before it gets there.
     */
    private static byte[] parseLiteral(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        String candidate = address.trim();
        boolean ipv6 = candidate.indexOf(':') >= 0;
        boolean ipv4 = !ipv6 && candidate.chars().allMatch(c -> c == '.' || Character.isDigit(c));
        if (!ipv4 && !ipv6) {
            return null;
        }
        if (ipv6 && !candidate.chars().allMatch(c -> c == ':' || c == '.' || Character.digit(c, 16) >= 0)) {
            return null;
        }
        try {
            return InetAddress.getByName(candidate).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
