package io.tributary.distributor.calc;

import java.util.List;
import java.util.Objects;

/**
 * Intermediate geometry of one distribution pass.
 */
public record DistributionDetails(CriticalPoints criticalPoints, List<Segment> segments, List<TributaryZone> zones) {

    public DistributionDetails {
        Objects.requireNonNull(criticalPoints, "criticalPoints");
        segments = List.copyOf(segments);
        zones = List.copyOf(zones);
    }

    /**
     * Width of the axis covered by some load.
     */
    public double loadedWidth() {
        return segments.stream().mapToDouble(Segment::width).sum();
    }
}
