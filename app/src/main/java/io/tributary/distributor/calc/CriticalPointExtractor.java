package io.tributary.distributor.calc;

import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Collects the coordinates the rest of the pipeline splits the transverse axis at.
 */
public class CriticalPointExtractor {

    private final Tolerance tolerance;

    public CriticalPointExtractor(Tolerance tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public CriticalPoints extract(List<RegionalLoad> loads, List<Beam> beams) {
        Objects.requireNonNull(loads, "loads");
        Objects.requireNonNull(beams, "beams");
        if (loads.isEmpty() && beams.isEmpty()) {
            throw new ConfigurationException("At least one load or one beam is required to distribute loads");
        }

        List<Double> boundaries = new ArrayList<>();
        for (Beam beam : beams) {
            boundaries.add(beam.position());
        }
        if (loads.isEmpty()) {
            boundaries.add(minPosition(beams));
            boundaries.add(maxPosition(beams));
        } else {
            boundaries.add(minStart(loads));
            boundaries.add(maxEnd(loads));
        }
        List<Double> sortedBoundaries = sortedDistinct(boundaries);

        List<Double> coordinates = new ArrayList<>(sortedBoundaries);
        for (RegionalLoad load : loads) {
            coordinates.add(load.yStart());
            coordinates.add(load.yEnd());
        }
        double lower = boundaries.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double upper = boundaries.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        return new CriticalPoints(sortedDistinct(coordinates), sortedBoundaries, lower, upper);
    }

    /**
     * Sorts ascending and drops every value within epsilon of the last value kept.
     */
    List<Double> sortedDistinct(Collection<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        List<Double> distinct = new ArrayList<>(sorted.size());
        for (double value : sorted) {
            if (distinct.isEmpty() || tolerance.isGreater(value, distinct.get(distinct.size() - 1))) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    private static double minStart(List<RegionalLoad> loads) {
        return loads.stream().mapToDouble(RegionalLoad::yStart).min().orElseThrow();
    }

    private static double maxEnd(List<RegionalLoad> loads) {
        return loads.stream().mapToDouble(RegionalLoad::yEnd).max().orElseThrow();
    }

    private static double minPosition(List<Beam> beams) {
        return beams.stream().mapToDouble(Beam::position).min().orElseThrow();
    }

    private static double maxPosition(List<Beam> beams) {
        return beams.stream().mapToDouble(Beam::position).max().orElseThrow();
    }
}
