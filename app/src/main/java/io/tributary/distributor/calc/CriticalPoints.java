package io.tributary.distributor.calc;

import java.util.List;

/**
 * Sorted, deduplicated coordinates where load coverage or beam responsibility can change.
 *
 * <p>The system extremes are kept separately from the deduplicated lists: deduplication keeps the
 * first of two values closer than epsilon, which may drop the true maximum.
 *
 * @param coordinates load edges, beam positions and system extremes
 * @param boundaries beam positions and the loaded region's extremes
 * @param lowerBoundary smallest boundary value before deduplication
 * @param upperBoundary largest boundary value before deduplication
 */
public record CriticalPoints(List<Double> coordinates, List<Double> boundaries, double lowerBoundary, double upperBoundary) {

    public CriticalPoints {
        coordinates = List.copyOf(coordinates);
        boundaries = List.copyOf(boundaries);
        if (boundaries.isEmpty()) {
            throw new IllegalArgumentException("boundaries must not be empty");
        }
        if (upperBoundary < lowerBoundary) {
            throw new IllegalArgumentException("Invalid system boundary: " + lowerBoundary + " > " + upperBoundary);
        }
    }

    public CriticalPoints(List<Double> coordinates, List<Double> boundaries) {
        this(coordinates, boundaries, first(boundaries), last(boundaries));
    }

    private static double first(List<Double> values) {
        return values.isEmpty() ? 0.0 : values.get(0);
    }

    private static double last(List<Double> values) {
        return values.isEmpty() ? 0.0 : values.get(values.size() - 1);
    }
}
