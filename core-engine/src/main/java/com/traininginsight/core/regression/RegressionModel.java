package com.traininginsight.core.regression;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A fitted linear model.
 *
 * <p>
 * Immutable: refitting always produces a new instance. Polynomial models
 * remember their degree and expand raw features in {@link #predict(double[])},
 * so callers always pass the original feature vector.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegressionModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] coefficients;
    private final double intercept;
    private final double r2Score;
    private final double mse;
    private final double mae;
    private final int sampleCount;
    private final RegressionType modelType;
    private final int polynomialDegree;
    private final Instant createdAt;

    private RegressionModel(Builder b) {
        this.coefficients = Objects.requireNonNull(b.coefficients, "coefficients must not be null").clone();
        this.intercept = b.intercept;
        this.r2Score = b.r2Score;
        this.mse = b.mse;
        this.mae = b.mae;
        this.sampleCount = b.sampleCount;
        this.modelType = Objects.requireNonNull(b.modelType, "modelType must not be null");
        this.polynomialDegree = b.polynomialDegree;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Predict {@code intercept + Σ coefficientᵢ · featureᵢ}.
     *
     * @param features raw feature vector (unexpanded for polynomial models)
     * @return prediction
     * @throws IllegalArgumentException if the vector has the wrong length
     */
    public double predict(double[] features) {
        Objects.requireNonNull(features, "features must not be null");
        double[] x = polynomialDegree >= 2
                ? PolynomialFeatures.expand(features, polynomialDegree)
                : features;
        if (x.length != coefficients.length) {
            throw new IllegalArgumentException("Model expects " + coefficients.length
                    + " features, got " + x.length);
        }
        double prediction = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            prediction += coefficients[i] * x[i];
        }
        return prediction;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder; {@code coefficients}, {@code modelType} and
     * {@code createdAt} are required.
     */
    public static class Builder {
        private double[] coefficients;
        private double intercept;
        private double r2Score;
        private double mse;
        private double mae;
        private int sampleCount;
        private RegressionType modelType;
        private int polynomialDegree;
        private Instant createdAt;

        public Builder coefficients(double[] coefficients) {
            this.coefficients = coefficients;
            return this;
        }

        public Builder intercept(double intercept) {
            this.intercept = intercept;
            return this;
        }

        public Builder r2Score(double r2Score) {
            this.r2Score = r2Score;
            return this;
        }

        public Builder mse(double mse) {
            this.mse = mse;
            return this;
        }

        public Builder mae(double mae) {
            this.mae = mae;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder modelType(RegressionType modelType) {
            this.modelType = modelType;
            return this;
        }

        public Builder polynomialDegree(int polynomialDegree) {
            this.polynomialDegree = polynomialDegree;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RegressionModel build() {
            return new RegressionModel(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    @JsonIgnore
    public int getCoefficientCount() {
        return coefficients.length;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getR2Score() {
        return r2Score;
    }

    public double getMse() {
        return mse;
    }

    public double getMae() {
        return mae;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public RegressionType getModelType() {
        return modelType;
    }

    public int getPolynomialDegree() {
        return polynomialDegree;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "RegressionModel{" +
                "type=" + modelType.getKey() +
                ", intercept=" + intercept +
                ", coefficients=" + Arrays.toString(coefficients) +
                ", r2=" + r2Score +
                ", mse=" + mse +
                ", mae=" + mae +
                ", n=" + sampleCount +
                '}';
    }
}
