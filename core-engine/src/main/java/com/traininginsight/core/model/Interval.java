package com.traininginsight.core.model;

import java.io.Serializable;

/**
 * Closed numeric interval {@code [lower, upper]}; bounds may be infinite.
 *
 * @since 1.0.0
 */
public final class Interval implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Interval that carries no information. */
    public static final Interval UNBOUNDED = new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    private final double lower;
    private final double upper;

    public Interval(double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("lower bound " + lower + " exceeds upper bound " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * @return {@code [center - halfWidth, center + halfWidth]}
     */
    public static Interval around(double center, double halfWidth) {
        return new Interval(center - halfWidth, center + halfWidth);
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Interval that))
            return false;
        return Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lower) + Double.hashCode(upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + ']';
    }
}
