package org.pdemeta.problem;

/**
 * The domain of one coordinate. Construction accepts any values so that a broken
 * declaration can be reported later with the coordinate's name attached.
 *
 * @param lower The lower bound.
 * @param upper The upper bound.
 */
public record Interval(double lower, double upper) {

    public static Interval of(double lower, double upper) {
        return new Interval(lower, upper);
    }

    /**
     * @return {@code true} if both bounds are finite numbers and {@code lower < upper}.
     */
    public boolean isWellFormed() {
        return Double.isFinite(lower) && Double.isFinite(upper) && lower < upper;
    }

    public double width() {
        return upper - lower;
    }

    /**
     * @param value The value to test.
     * @param tolerance The relative tolerance, scaled by {@code max(1, |lower|)}.
     * @return {@code true} if {@code value} lies on the lower bound.
     */
    public boolean isAtLower(double value, double tolerance) {
        return Math.abs(value - lower) <= tolerance * Math.max(1.0, Math.abs(lower));
    }

    /**
     * @param value The value to test.
     * @param tolerance The relative tolerance, scaled by {@code max(1, |upper|)}.
     * @return {@code true} if {@code value} lies on the upper bound.
     */
    public boolean isAtUpper(double value, double tolerance) {
        return Math.abs(value - upper) <= tolerance * Math.max(1.0, Math.abs(upper));
    }

    @Override
    public String toString() {
        return "(" + lower + ", " + upper + ")";
    }
}
