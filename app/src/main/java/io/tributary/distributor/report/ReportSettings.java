package io.tributary.distributor.report;

import java.util.Objects;

/**
 * Number formatting and unit labels used when rendering a report.
 */
public record ReportSettings(int decimals, String forceUnit, String lengthUnit) {

    public static final int DEFAULT_DECIMALS = 3;
    public static final int MAX_DECIMALS = 12;
    public static final String DEFAULT_FORCE_UNIT = "kN";
    public static final String DEFAULT_LENGTH_UNIT = "m";

    public ReportSettings {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals must be between 0 and " + MAX_DECIMALS);
        }
        forceUnit = requireNonBlank(forceUnit, "forceUnit");
        lengthUnit = requireNonBlank(lengthUnit, "lengthUnit");
    }

    public static ReportSettings defaults() {
        return new ReportSettings(DEFAULT_DECIMALS, DEFAULT_FORCE_UNIT, DEFAULT_LENGTH_UNIT);
    }

    public String lineLoadUnit() {
        return forceUnit + "/" + lengthUnit;
    }

    public String areaLoadUnit() {
        return forceUnit + "/" + lengthUnit + "²";
    }

    private static String requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
