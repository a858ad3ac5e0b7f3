package io.tributary.distributor.calc;

import io.tributary.distributor.model.Beam;
import io.tributary.distributor.model.RegionalLoad;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes regional loads onto beams by tributary width.
 *
 * <p>Runs critical point extraction, segment building, zone assignment and contribution
 * calculation in that order. The inputs are never modified, so repeated calls with the same
 * arguments return equal results.
 */
public class LoadDistributionCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoadDistributionCalculator.class);

    private final Tolerance tolerance;
    private final CriticalPointExtractor extractor;
    private final SegmentBuilder segmentBuilder;
    private final TributaryZoneAssigner zoneAssigner;
    private final ContributionCalculator contributionCalculator;

    public LoadDistributionCalculator() {
        this(Tolerance.defaults());
    }

    public LoadDistributionCalculator(Tolerance tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
        this.extractor = new CriticalPointExtractor(tolerance);
        this.segmentBuilder = new SegmentBuilder(tolerance);
        this.zoneAssigner = new TributaryZoneAssigner();
        this.contributionCalculator = new ContributionCalculator(tolerance);
    }

    public DistributionResult calculate(List<RegionalLoad> loads, List<Beam> beams) {
        Objects.requireNonNull(loads, "loads");
        Objects.requireNonNull(beams, "beams");

        CriticalPoints criticalPoints = extractor.extract(loads, beams);
        LOGGER.debug("Extracted {} critical coordinates, system boundary [{}, {}]",
                criticalPoints.coordinates().size(), criticalPoints.lowerBoundary(), criticalPoints.upperBoundary());

        List<Segment> segments = segmentBuilder.build(criticalPoints.coordinates(), loads);
        LOGGER.debug("Built {} loaded segments from {} loads", segments.size(), loads.size());

        List<TributaryZone> zones = zoneAssigner.assign(beams, criticalPoints);
        List<BeamResult> results = contributionCalculator.calculate(zones, segments);
        for (BeamResult result : results) {
            LOGGER.debug("Beam {} zone [{}, {}] receives {} contributions, total {}",
                    result.beam().name(), result.zone().lower(), result.zone().upper(),
                    result.contributions().size(), result.total());
        }

        return new DistributionResult(loads, results, new DistributionDetails(criticalPoints, segments, zones), tolerance);
    }

    public Tolerance tolerance() {
        return tolerance;
    }
}
