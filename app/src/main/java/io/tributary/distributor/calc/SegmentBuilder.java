package io.tributary.distributor.calc;

import io.tributary.distributor.model.RegionalLoad;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tags each interval between critical coordinates with the load that fully covers it.
 *
 * <p>When loads overlap, the one with the smallest {@code yStart} wins; intervals no load covers
 * yield no segment and therefore carry no load.
 */
public class SegmentBuilder {

    private static final Comparator<RegionalLoad> BY_START = Comparator.comparingDouble(RegionalLoad::yStart);

    private final Tolerance tolerance;

    public SegmentBuilder(Tolerance tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<Segment> build(List<Double> coordinates, List<RegionalLoad> loads) {
        Objects.requireNonNull(coordinates, "coordinates");
        Objects.requireNonNull(loads, "loads");
        List<RegionalLoad> ordered = new ArrayList<>(loads);
        ordered.sort(BY_START);

        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i + 1 < coordinates.size(); i++) {
            double y1 = coordinates.get(i);
            double y2 = coordinates.get(i + 1);
            if (!tolerance.isGreater(y2, y1)) {
                continue;
            }
            coveringLoad(ordered, y1, y2)
                    .map(load -> new Segment(y1, y2, load.name(), load.intensity()))
                    .ifPresent(segments::add);
        }
        return segments;
    }

    private Optional<RegionalLoad> coveringLoad(List<RegionalLoad> ordered, double y1, double y2) {
        double epsilon = tolerance.epsilon();
        for (RegionalLoad load : ordered) {
            if (load.yStart() <= y1 + epsilon && load.yEnd() >= y2 - epsilon) {
                return Optional.of(load);
            }
        }
        return Optional.empty();
    }
}
