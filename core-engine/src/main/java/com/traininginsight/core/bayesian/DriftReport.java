package com.traininginsight.core.bayesian;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of comparing recent residuals with the model's expected noise.
 *
 * @since 1.0.0
 */
public final class DriftReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean drift;
    private final double severity;
    private final String recommendation;

    public DriftReport(boolean drift, double severity, String recommendation) {
        this.drift = drift;
        this.severity = severity;
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation must not be null");
    }

    public boolean hasDrift() {
        return drift;
    }

    /** @return observed residual variance divided by expected noise variance */
    public double getSeverity() {
        return severity;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public String toString() {
        return "DriftReport{drift=" + drift + ", severity=" + severity + ", recommendation='" + recommendation + "'}";
    }
}
