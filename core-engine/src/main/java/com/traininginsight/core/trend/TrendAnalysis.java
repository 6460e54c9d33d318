package com.traininginsight.core.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Result of a Mann-Kendall trend test with Sen's slope.
 *
 * <p>
 * {@link #getDirection()} is {@link TrendDirection#STABLE} whenever
 * {@link #getPValue()} is at least {@value TrendAnalyzer#SIGNIFICANCE_LEVEL},
 * whatever the sign of the slope.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TrendDirection direction;
    private final double slope;
    private final double confidence;
    private final double pValue;
    private final double kendallTau;

    public TrendAnalysis(TrendDirection direction, double slope, double confidence, double pValue, double kendallTau) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.slope = slope;
        this.confidence = confidence;
        this.pValue = pValue;
        this.kendallTau = kendallTau;
    }

    /**
     * @return the result used when there is too little data to test
     */
    public static TrendAnalysis none() {
        return new TrendAnalysis(TrendDirection.STABLE, 0, 0, 1, 0);
    }

    public TrendDirection getDirection() {
        return direction;
    }

    /** @return Sen's slope in target units per day */
    public double getSlope() {
        return slope;
    }

    /** @return {@code 1 - pValue} */
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("pValue")
    public double getPValue() {
        return pValue;
    }

    public double getKendallTau() {
        return kendallTau;
    }

    public boolean isSignificant() {
        return pValue < TrendAnalyzer.SIGNIFICANCE_LEVEL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendAnalysis that))
            return false;
        return direction == that.direction
                && Double.compare(slope, that.slope) == 0
                && Double.compare(pValue, that.pValue) == 0
                && Double.compare(kendallTau, that.kendallTau) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, slope, pValue, kendallTau);
    }

    @Override
    public String toString() {
        return "TrendAnalysis{" +
                "direction=" + direction.getKey() +
                ", slope=" + slope +
                ", pValue=" + pValue +
                ", tau=" + kendallTau +
                '}';
    }
}
