package io.tributary.distributor.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Intersects tributary zones with load segments.
 *
 * <p>Every overlapping piece becomes its own {@link Contribution}, so a load split by other
 * critical coordinates shows up several times for the same beam.
 */
public class ContributionCalculator {

    private final Tolerance tolerance;

    public ContributionCalculator(Tolerance tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<BeamResult> calculate(List<TributaryZone> zones, List<Segment> segments) {
        Objects.requireNonNull(zones, "zones");
        Objects.requireNonNull(segments, "segments");
        List<BeamResult> results = new ArrayList<>(zones.size());
        for (TributaryZone zone : zones) {
            results.add(calculate(zone, segments));
        }
        return results;
    }

    BeamResult calculate(TributaryZone zone, List<Segment> segments) {
        List<Contribution> contributions = new ArrayList<>();
        double total = 0.0;
        for (Segment segment : segments) {
            double start = Math.max(zone.lower(), segment.start());
            double end = Math.min(zone.upper(), segment.end());
            if (!tolerance.isGreater(end, start)) {
                continue;
            }
            double width = end - start;
            double value = segment.intensity() * width;
            contributions.add(new Contribution(segment.loadName(), start, end, width, value));
            total += value;
        }
        return new BeamResult(zone, contributions, total);
    }
}
