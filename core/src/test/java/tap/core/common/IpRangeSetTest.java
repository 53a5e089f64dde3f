package tap.core.common;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IpRangeSetTest {

    @Test
    void testIpv4Cidr() {
        IpRange range = IpRange.parse("10.0.0.0/8");

        assertTrue(range.contains("10.1.2.3"));
        assertTrue(range.contains("10.255.255.255"));
        assertFalse(range.contains("11.0.0.1"));
    }

    @Test
    void testNonByteAlignedPrefix() {
        IpRange range = IpRange.parse("192.168.4.0/22");

        assertTrue(range.contains("192.168.7.200"));
        assertFalse(range.contains("192.168.8.1"));
    }

    @Test
    void testBareAddressIsSingleHost() {
        IpRange range = IpRange.parse("127.0.0.1");

        assertTrue(range.contains("127.0.0.1"));
        assertFalse(range.contains("127.0.0.2"));
    }

    @Test
    void testIpv6() {
        IpRange range = IpRange.parse("2001:db8::/32");

        assertTrue(range.contains("2001:db8:1::5"));
        assertFalse(range.contains("2001:db9::1"));
        assertFalse(range.contains("10.0.0.1"), "IPv4 never matches an IPv6 block");
    }

    @Test
    void testUnparseableCandidateIsNotContained() {
        IpRange range = IpRange.parse("0.0.0.0/0");

        assertFalse(range.contains("unknown"));
        assertFalse(range.contains("example.com"));
        assertFalse(range.contains(null));
    }

    @Test
    void testInvalidRangesRejected() {
        assertThrows(IllegalArgumentException.class, () -> IpRange.parse("10.0.0.0/33"));
        assertThrows(IllegalArgumentException.class, () -> IpRange.parse("10.0.0.0/x"));
        assertThrows(IllegalArgumentException.class, () -> IpRange.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> IpRange.parse(" "));
    }

    @Test
    void testSetMatchesAnyRange() {
        IpRangeSet set = IpRangeSet.of(List.of("10.0.0.0/8", "192.168.1.7"));

        assertTrue(set.contains("10.9.9.9"));
        assertTrue(set.contains("192.168.1.7"));
        assertFalse(set.contains("192.168.1.8"));
        assertEquals(2, set.size());
    }
}
