package com.traininginsight.core.forecast;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Additive split {@code value = trend + seasonal + residual}, index-aligned
 * with the decomposed series.
 *
 * @since 1.0.0
 */
public final class SeriesDecomposition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Double> trend;
    private final List<Double> seasonal;
    private final List<Double> residual;

    public SeriesDecomposition(List<Double> trend, List<Double> seasonal, List<Double> residual) {
        this.trend = List.copyOf(Objects.requireNonNull(trend, "trend must not be null"));
        this.seasonal = List.copyOf(Objects.requireNonNull(seasonal, "seasonal must not be null"));
        this.residual = List.copyOf(Objects.requireNonNull(residual, "residual must not be null"));
    }

    public List<Double> getTrend() {
        return trend;
    }

    public List<Double> getSeasonal() {
        return seasonal;
    }

    public List<Double> getResidual() {
        return residual;
    }

    @Override
    public String toString() {
        return "SeriesDecomposition{points=" + trend.size() + '}';
    }
}
