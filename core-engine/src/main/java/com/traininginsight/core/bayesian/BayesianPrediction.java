package com.traininginsight.core.bayesian;

import com.traininginsight.core.model.Interval;

import java.io.Serializable;
import java.util.Objects;

/**
 * Posterior predictive summary for one feature vector.
 *
 * @since 1.0.0
 */
public final class BayesianPrediction implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double variance;
    private final Interval credibleInterval;

    public BayesianPrediction(double mean, double variance, Interval credibleInterval) {
        this.mean = mean;
        this.variance = variance;
        this.credibleInterval = Objects.requireNonNull(credibleInterval, "credibleInterval must not be null");
    }

    public double getMean() {
        return mean;
    }

    /** @return noise variance plus parameter variance; infinite before any data */
    public double getVariance() {
        return variance;
    }

    public Interval getCredibleInterval() {
        return credibleInterval;
    }

    @Override
    public String toString() {
        return "BayesianPrediction{mean=" + mean + ", variance=" + variance + ", interval=" + credibleInterval + '}';
    }
}
