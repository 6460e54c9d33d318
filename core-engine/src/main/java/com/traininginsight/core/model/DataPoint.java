package com.traininginsight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A featurized observation ready for model fitting.
 *
 * <p>
 * The feature array is copied on the way in and on the way out, so a
 * {@code DataPoint} is effectively immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] features;
    private final double target;
    private final double weight;
    private final Instant timestamp;

    /**
     * @param features  feature vector; must not be {@code null}
     * @param target    value to predict
     * @param weight    observation weight (1 unless time-decayed)
     * @param timestamp session time, may be {@code null}
     */
    public DataPoint(double[] features, double target, double weight, Instant timestamp) {
        this.features = Objects.requireNonNull(features, "features must not be null").clone();
        this.target = target;
        this.weight = weight;
        this.timestamp = timestamp;
    }

    /**
     * Unweighted point without a timestamp.
     */
    public DataPoint(double[] features, double target) {
        this(features, target, 1.0, null);
    }

    public double[] getFeatures() {
        return features.clone();
    }

    /** @return number of features without copying the vector */
    public int dimension() {
        return features.length;
    }

    /** @return the feature at {@code index} */
    public double feature(int index) {
        return features[index];
    }

    public double getTarget() {
        return target;
    }

    public double getWeight() {
        return weight;
    }

    /** @return session time, or {@code null} */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return a copy of this point with a different weight
     */
    public DataPoint withWeight(double newWeight) {
        return new DataPoint(features, target, newWeight, timestamp);
    }

    /**
     * @return a copy of this point with a different feature vector
     */
    public DataPoint withFeatures(double[] newFeatures) {
        return new DataPoint(newFeatures, target, weight, timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(target, that.target) == 0
                && Double.compare(weight, that.weight) == 0
                && Arrays.equals(features, that.features)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(target, weight, timestamp) + Arrays.hashCode(features);
    }

    @Override
    public String toString() {
        return "DataPoint{" +
                "features=" + Arrays.toString(features) +
                ", target=" + target +
                ", weight=" + weight +
                ", timestamp=" + timestamp +
                '}';
    }
}
