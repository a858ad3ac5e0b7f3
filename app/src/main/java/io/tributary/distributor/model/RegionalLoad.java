package io.tributary.distributor.model;

import java.util.Objects;

/**
 * Area load acting over {@code [yStart, yEnd)} on the transverse axis.
 *
 * <p>{@code length} and {@code color} only describe the load rectangle for drawing and play no
 * part in the distribution.
 */
public record RegionalLoad(String name, double intensity, double yStart, double yEnd, double length, String color) {

    public static final String DEFAULT_COLOR = "blue";

    public RegionalLoad {
        name = requireNonBlank(name, "name");
        requireFinite(intensity, "intensity");
        requireFinite(yStart, "yStart");
        requireFinite(yEnd, "yEnd");
        requireFinite(length, "length");
        if (yEnd < yStart) {
            throw new IllegalArgumentException("Load " + name + " has negative width: yStart=" + yStart + " yEnd=" + yEnd);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Load " + name + " must have a non-negative length");
        }
        color = color == null || color.isBlank() ? DEFAULT_COLOR : color;
    }

    public RegionalLoad(String name, double intensity, double yStart, double yEnd, double length) {
        this(name, intensity, yStart, yEnd, length, DEFAULT_COLOR);
    }

    public double width() {
        return yEnd - yStart;
    }

    /**
     * Load per unit length carried by the whole strip, {@code intensity * width}.
     */
    public double totalLoad() {
        return intensity * width();
    }

    static String requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    static void requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be a finite number but was " + value);
        }
    }
}
