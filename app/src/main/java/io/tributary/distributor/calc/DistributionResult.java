package io.tributary.distributor.calc;

import io.tributary.distributor.model.RegionalLoad;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link LoadDistributionCalculator#calculate}: one {@link BeamResult} per beam in
 * ascending position order, plus the geometry they were derived from.
 */
public record DistributionResult(List<RegionalLoad> loads,
                                 List<BeamResult> beamResults,
                                 DistributionDetails details,
                                 Tolerance tolerance) {

    public DistributionResult {
        loads = List.copyOf(loads);
        beamResults = List.copyOf(beamResults);
        Objects.requireNonNull(details, "details");
        Objects.requireNonNull(tolerance, "tolerance");
    }

    public Optional<BeamResult> resultFor(String beamName) {
        return beamResults.stream()
                .filter(result -> result.beam().name().equals(beamName))
                .findFirst();
    }

    public double totalDistributed() {
        return beamResults.stream().mapToDouble(BeamResult::total).sum();
    }

    /**
     * Sum of {@code intensity * width} over the input loads, regardless of coverage.
     */
    public double totalApplied() {
        return loads.stream().mapToDouble(RegionalLoad::totalLoad).sum();
    }
}
