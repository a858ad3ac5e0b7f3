package io.tributary.distributor.calc;

/**
 * Coordinate tolerance shared by every comparison of one distribution pass.
 */
public record Tolerance(double epsilon) {

    public static final double DEFAULT_EPSILON = 1e-9;

    public Tolerance {
        if (!Double.isFinite(epsilon) || epsilon <= 0) {
            throw new IllegalArgumentException("tolerance must be a positive finite number but was " + epsilon);
        }
    }

    public static Tolerance defaults() {
        return new Tolerance(DEFAULT_EPSILON);
    }

    /**
     * True when {@code b} lies more than epsilon above {@code a}.
     */
    public boolean isGreater(double b, double a) {
        return b - a > epsilon;
    }
}
