package io.tributary.distributor.calc;

import io.tributary.distributor.model.Beam;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Splits the system between beams at the midpoints of neighbouring positions.
 *
 * <p>The first and last beam extend out to the system boundaries, so the zones always tile
 * {@code [lowerBoundary, upperBoundary]} without gaps.
 */
public class TributaryZoneAssigner {

    public List<TributaryZone> assign(List<Beam> beams, CriticalPoints criticalPoints) {
        Objects.requireNonNull(beams, "beams");
        Objects.requireNonNull(criticalPoints, "criticalPoints");
        List<Beam> ordered = sortByPosition(beams);

        List<TributaryZone> zones = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Beam beam = ordered.get(i);
            double lower = i > 0
                    ? midpoint(ordered.get(i - 1).position(), beam.position())
                    : criticalPoints.lowerBoundary();
            double upper = i < ordered.size() - 1
                    ? midpoint(beam.position(), ordered.get(i + 1).position())
                    : criticalPoints.upperBoundary();
            zones.add(new TributaryZone(beam, lower, upper));
        }
        return zones;
    }

    static List<Beam> sortByPosition(List<Beam> beams) {
        List<Beam> ordered = new ArrayList<>(beams);
        ordered.sort(Comparator.comparingDouble(Beam::position));
        return ordered;
    }

    private static double midpoint(double a, double b) {
        return (a + b) / 2.0;
    }
}
