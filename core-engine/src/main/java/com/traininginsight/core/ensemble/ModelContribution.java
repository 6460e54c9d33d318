package com.traininginsight.core.ensemble;

import java.io.Serializable;
import java.util.Objects;

/**
 * One member's share of a combined prediction.
 *
 * @since 1.0.0
 */
public final class ModelContribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final double prediction;
    private final double weight;

    public ModelContribution(String modelId, double prediction, double weight) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.prediction = prediction;
        this.weight = weight;
    }

    public String getModelId() {
        return modelId;
    }

    public double getPrediction() {
        return prediction;
    }

    /** @return normalized weight; contributions of one prediction sum to 1 */
    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return modelId + '=' + prediction + " (w=" + weight + ')';
    }
}
