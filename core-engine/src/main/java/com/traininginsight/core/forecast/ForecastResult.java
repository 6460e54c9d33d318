package com.traininginsight.core.forecast;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Short-horizon forecast with a symmetric prediction band per step.
 *
 * @since 1.0.0
 */
public final class ForecastResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Double> predictions;
    private final List<Double> lowerBound;
    private final List<Double> upperBound;
    private final double confidence;
    private final String method;

    public ForecastResult(List<Double> predictions, List<Double> lowerBound, List<Double> upperBound,
                          double confidence, String method) {
        this.predictions = List.copyOf(Objects.requireNonNull(predictions, "predictions must not be null"));
        this.lowerBound = List.copyOf(Objects.requireNonNull(lowerBound, "lowerBound must not be null"));
        this.upperBound = List.copyOf(Objects.requireNonNull(upperBound, "upperBound must not be null"));
        if (this.lowerBound.size() != this.predictions.size() || this.upperBound.size() != this.predictions.size()) {
            throw new IllegalArgumentException("Bounds must have one entry per prediction");
        }
        this.confidence = confidence;
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    static ForecastResult empty(String method) {
        return new ForecastResult(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), 0, method);
    }

    public List<Double> getPredictions() {
        return predictions;
    }

    public List<Double> getLowerBound() {
        return lowerBound;
    }

    public List<Double> getUpperBound() {
        return upperBound;
    }

    /** @return self-reported fit quality in [0, 1] */
    public double getConfidence() {
        return confidence;
    }

    /** @return e.g. {@code triple_exponential_smoothing} or {@code moving_average_5} */
    public String getMethod() {
        return method;
    }

    public boolean isEmpty() {
        return predictions.isEmpty();
    }

    @Override
    public String toString() {
        return "ForecastResult{" +
                "method='" + method + '\'' +
                ", confidence=" + confidence +
                ", predictions=" + predictions +
                '}';
    }
}
