package io.tributary.distributor.calc;

import java.util.Objects;

/**
 * Interval between two consecutive critical coordinates and the load covering it.
 */
public record Segment(double start, double end, String loadName, double intensity) {

    public Segment {
        Objects.requireNonNull(loadName, "loadName");
        if (end < start) {
            throw new IllegalArgumentException("Invalid segment boundaries: " + start + " > " + end);
        }
    }

    public double width() {
        return end - start;
    }
}
