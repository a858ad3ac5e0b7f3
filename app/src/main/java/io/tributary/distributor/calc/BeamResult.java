package io.tributary.distributor.calc;

import io.tributary.distributor.model.Beam;
import java.util.List;
import java.util.Objects;

/**
 * Itemized and totaled distributed load of one beam.
 */
public record BeamResult(TributaryZone zone, List<Contribution> contributions, double total) {

    public BeamResult {
        Objects.requireNonNull(zone, "zone");
        contributions = List.copyOf(contributions);
    }

    public Beam beam() {
        return zone.beam();
    }

    /**
     * Sum of all contributions coming from the named load.
     */
    public double totalFrom(String loadName) {
        return contributions.stream()
                .filter(contribution -> contribution.loadName().equals(loadName))
                .mapToDouble(Contribution::value)
                .sum();
    }
}
