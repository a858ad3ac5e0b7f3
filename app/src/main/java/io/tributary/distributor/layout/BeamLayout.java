package io.tributary.distributor.layout;

import io.tributary.distributor.calc.ConfigurationException;
import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import java.util.List;
import java.util.Objects;

/**
 * Positions beams relative to the loaded region.
 */
public final class BeamLayout {

    private BeamLayout() {
    }

    /**
     * Two beams, one on each outer edge of the loaded region.
     */
    public static List<Beam> atLoadEdges(List<RegionalLoad> loads, String firstName, String lastName, double length) {
        Objects.requireNonNull(loads, "loads");
        if (loads.isEmpty()) {
            throw new ConfigurationException("Edge beams need at least one load to locate the loaded region");
        }
        double start = loads.stream().mapToDouble(RegionalLoad::yStart).min().orElseThrow();
        double end = loads.stream().mapToDouble(RegionalLoad::yEnd).max().orElseThrow();
        return List.of(new Beam(firstName, start, length), new Beam(lastName, end, length));
    }

    /**
     * Longest load rectangle, used as the default beam length.
     */
    public static double spanOf(List<RegionalLoad> loads) {
        return loads.stream().mapToDouble(RegionalLoad::length).max().orElse(0.0);
    }
}
