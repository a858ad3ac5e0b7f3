package io.tributary.distributor.report;

import io.tributary.distributor.calc.BeamResult;
import io.tributary.distributor.calc.Contribution;
import io.tributary.distributor.calc.DistributionResult;
import io.tributary.distributor.calc.TributaryZone;
import io.tributary.distributor.model.RegionalLoad;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link DistributionResult} as a plain-text report.
 */
public class ReportGenerator {

    static final String MISMATCH_WARNING = "WARNING: distributed load differs from applied load";

    private final ReportSettings settings;

    public ReportGenerator(ReportSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public String render(DistributionResult result) {
        Objects.requireNonNull(result, "result");
        StringBuilder builder = new StringBuilder();
        builder.append("--- LOAD DISTRIBUTION ---").append(System.lineSeparator());

        builder.append(System.lineSeparator()).append("Loads:").append(System.lineSeparator());
        if (result.loads().isEmpty()) {
            builder.append("  (none)").append(System.lineSeparator());
        }
        for (RegionalLoad load : result.loads()) {
            builder.append("  ").append(load.name())
                    .append(": ").append(number(load.intensity())).append(' ').append(settings.areaLoadUnit())
                    .append(" over ").append(interval(load.yStart(), load.yEnd()))
                    .append(" (").append(length(load.width())).append(')')
                    .append(System.lineSeparator());
        }

        for (BeamResult beamResult : result.beamResults()) {
            appendBeam(builder, beamResult);
        }

        double applied = result.totalApplied();
        double distributed = result.totalDistributed();
        builder.append(System.lineSeparator());
        builder.append("Total applied load:     ").append(lineLoad(applied)).append(System.lineSeparator());
        builder.append("Total distributed load: ").append(lineLoad(distributed)).append(System.lineSeparator());
        if (!result.beamResults().isEmpty() && Math.abs(applied - distributed) > checkTolerance(result)) {
            builder.append(MISMATCH_WARNING)
                    .append(" by ").append(lineLoad(distributed - applied))
                    .append(" (check for gaps or overlaps between loads)")
                    .append(System.lineSeparator());
        }
        builder.append("-------------------------").append(System.lineSeparator());
        return builder.toString();
    }

    private void appendBeam(StringBuilder builder, BeamResult beamResult) {
        TributaryZone zone = beamResult.zone();
        builder.append(System.lineSeparator());
        builder.append("Beam: ").append(beamResult.beam().name())
                .append(" at y=").append(length(beamResult.beam().position()))
                .append(System.lineSeparator());
        builder.append("  Tributary zone: ").append(interval(zone.lower(), zone.upper()))
                .append(" (").append(length(zone.width())).append(')')
                .append(System.lineSeparator());
        if (beamResult.contributions().isEmpty()) {
            builder.append("  (no load within tributary zone)").append(System.lineSeparator());
        }
        for (Contribution contribution : beamResult.contributions()) {
            builder.append("  from ").append(contribution.loadName())
                    .append(' ').append(interval(contribution.start(), contribution.end()))
                    .append(", width ").append(length(contribution.effectiveWidth()))
                    .append(": ").append(lineLoad(contribution.value()))
                    .append(System.lineSeparator());
        }
        builder.append("  Total distributed load: ").append(lineLoad(beamResult.total()))
                .append(System.lineSeparator());
    }

    // Half of the last printed digit; anything smaller would not show in the report anyway.
    private double checkTolerance(DistributionResult result) {
        double printed = 0.5 * Math.pow(10, -settings.decimals());
        return Math.max(printed, result.tolerance().epsilon());
    }

    private String interval(double start, double end) {
        return "[" + number(start) + ", " + number(end) + ")";
    }

    private String length(double value) {
        return number(value) + " " + settings.lengthUnit();
    }

    private String lineLoad(double value) {
        return number(value) + " " + settings.lineLoadUnit();
    }

    private String number(double value) {
        String formatted = String.format(Locale.ROOT, "%." + settings.decimals() + "f", value);
        // Avoid printing "-0.000" for values that round to zero.
        if (formatted.startsWith("-") && formatted.chars().noneMatch(ch -> ch >= '1' && ch <= '9')) {
            return formatted.substring(1);
        }
        return formatted;
    }
}
