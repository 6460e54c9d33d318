package com.traininginsight.core.ensemble;

import com.traininginsight.core.model.Interval;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The single forecast produced by a learning run.
 *
 * <p>
 * An infinite {@link #getUncertainty()} signals that no usable model was
 * available; {@link #isAvailable()} tests for it.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsemblePrediction implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Method reported when fewer members than required were supplied. */
    public static final String INSUFFICIENT_MODELS = "insufficient_models";

    /** Method reported when too few clean observations remained. */
    public static final String INSUFFICIENT_DATA = "insufficient_data";

    private final double value;
    private final double confidence;
    private final double uncertainty;
    private final Interval interval;
    private final List<ModelContribution> modelContributions;
    private final String method;

    public EnsemblePrediction(double value, double confidence, double uncertainty, Interval interval,
                              List<ModelContribution> modelContributions, String method) {
        this.value = value;
        this.confidence = confidence;
        this.uncertainty = uncertainty;
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.modelContributions = List.copyOf(
                Objects.requireNonNull(modelContributions, "modelContributions must not be null"));
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    /**
     * @return value 0, confidence 0, infinite uncertainty and an unbounded
     *         interval, tagged with {@code method}
     */
    public static EnsemblePrediction unavailable(String method) {
        return new EnsemblePrediction(0, 0, Double.POSITIVE_INFINITY, Interval.UNBOUNDED,
                Collections.emptyList(), method);
    }

    public double getValue() {
        return value;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getUncertainty() {
        return uncertainty;
    }

    /** @return {@code value ± 1.96 · uncertainty} */
    public Interval getInterval() {
        return interval;
    }

    public List<ModelContribution> getModelContributions() {
        return modelContributions;
    }

    public String getMethod() {
        return method;
    }

    public boolean isAvailable() {
        return !Double.isInfinite(uncertainty);
    }

    @Override
    public String toString() {
        return "EnsemblePrediction{" +
                "value=" + value +
                ", confidence=" + confidence +
                ", uncertainty=" + uncertainty +
                ", method='" + method + '\'' +
                ", contributions=" + modelContributions +
                '}';
    }
}
