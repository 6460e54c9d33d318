package com.traininginsight.core.bayesian;

import com.traininginsight.core.math.Matrices;

import java.io.Serializable;

/**
 * Parameters of a Normal-Gamma distribution over linear coefficients and
 * noise precision: coefficient mean, coefficient precision matrix and the
 * Gamma shape/rate of the noise precision.
 *
 * @since 1.0.0
 */
public final class NormalGamma implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] mean;
    private final double[][] precision;
    private final double alpha;
    private final double beta;

    NormalGamma(double[] mean, double[][] precision, double alpha, double beta) {
        this.mean = mean.clone();
        this.precision = Matrices.copy(precision);
        this.alpha = alpha;
        this.beta = beta;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[][] getPrecision() {
        return Matrices.copy(precision);
    }

    /** @return Gamma shape of the noise precision */
    public double getAlpha() {
        return alpha;
    }

    /** @return Gamma rate of the noise precision */
    public double getBeta() {
        return beta;
    }

    int dimension() {
        return mean.length;
    }

    // package-private views without copying, for the updater's arithmetic
    double[] meanView() {
        return mean;
    }

    double[][] precisionView() {
        return precision;
    }
}
