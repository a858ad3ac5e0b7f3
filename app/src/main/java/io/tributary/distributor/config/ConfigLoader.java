package io.tributary.distributor.config;

import io.tributary.distributor.calc.Tolerance;
import io.tributary.distributor.cli.CliArguments;
import io.tributary.distributor.report.ReportSettings;
import java.util.Objects;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_TOLERANCE = "DISTRIBUTION_TOLERANCE";
    static final String ENV_REPORT_DECIMALS = "REPORT_DECIMALS";
    static final String ENV_REPORT_FORCE_UNIT = "REPORT_FORCE_UNIT";
    static final String ENV_REPORT_LENGTH_UNIT = "REPORT_LENGTH_UNIT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Tolerance tolerance = new Tolerance(resolveTolerance(arguments));
        ReportSettings reportSettings = new ReportSettings(
                resolveDecimals(arguments),
                firstNonBlank(ENV_REPORT_FORCE_UNIT, ReportSettings.DEFAULT_FORCE_UNIT),
                firstNonBlank(ENV_REPORT_LENGTH_UNIT, ReportSettings.DEFAULT_LENGTH_UNIT));
        return new Config(tolerance, reportSettings, resolveLogFormat(arguments));
    }

    private double resolveTolerance(CliArguments arguments) {
        Double cliValue = arguments.tolerance();
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.nonBlank(ENV_TOLERANCE)
                .map(raw -> parseDouble(raw, ENV_TOLERANCE))
                .orElse(Tolerance.DEFAULT_EPSILON);
    }

    private int resolveDecimals(CliArguments arguments) {
        Integer cliValue = arguments.decimals();
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.nonBlank(ENV_REPORT_DECIMALS)
                .map(raw -> parseInteger(raw, ENV_REPORT_DECIMALS))
                .orElse(ReportSettings.DEFAULT_DECIMALS);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String envKey, String defaultValue) {
        return environmentReader.nonBlank(envKey).orElse(defaultValue);
    }

    private static int parseInteger(String raw, String field) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(field + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String field) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value for " + field + ": " + raw, ex);
        }
    }
}
