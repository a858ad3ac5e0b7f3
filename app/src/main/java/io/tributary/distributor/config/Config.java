package io.tributary.distributor.config;

import io.tributary.distributor.calc.Tolerance;
import io.tributary.distributor.report.ReportSettings;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(Tolerance tolerance, ReportSettings reportSettings, LogFormat logFormat) {

    public Config {
        Objects.requireNonNull(tolerance, "tolerance");
        Objects.requireNonNull(reportSettings, "reportSettings");
        Objects.requireNonNull(logFormat, "logFormat");
    }

    public static Config defaults() {
        return new Config(Tolerance.defaults(), ReportSettings.defaults(), LogFormat.TEXT);
    }
}
