package tap.core.common;

import java.util.Collection;
import java.util.List;

/**
 * Immutable set of CIDR blocks with a membership test.
 */
public final class IpRangeSet {

    private final List<IpRange> ranges;

    private IpRangeSet(List<IpRange> ranges) {
        this.ranges = ranges;
    }

    public static IpRangeSet of(Collection<String> cidrs) {
        if (cidrs == null) {
            throw new IllegalArgumentException("cidrs cannot be null");
        }
        return new IpRangeSet(cidrs.stream().map(IpRange::parse).toList());
    }

    public boolean contains(String ip) {
        for (IpRange range : ranges) {
            if (range.contains(ip)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return ranges.size();
    }
}
