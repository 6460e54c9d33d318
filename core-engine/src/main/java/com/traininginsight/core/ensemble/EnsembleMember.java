package com.traininginsight.core.ensemble;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one model's contribution to an ensemble.
 *
 * <p>
 * Immutable; rebuilt every run. Instances are created via {@link Builder}.
 * Only the first prediction takes part in combination.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleMember implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final MemberType type;
    private final double weight;
    private final ModelPerformance performance;
    private final List<Double> predictions;
    private final Double confidence;

    private EnsembleMember(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.weight = builder.weight;
        this.performance = Objects.requireNonNull(builder.performance, "performance must not be null");
        this.predictions = List.copyOf(builder.predictions);
        if (this.predictions.isEmpty()) {
            throw new IllegalArgumentException("Member '" + id + "' has no predictions");
        }
        this.confidence = builder.confidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String id;
        private String name;
        private MemberType type;
        private double weight = 1.0;
        private ModelPerformance performance;
        private final List<Double> predictions = new ArrayList<>();
        private Double confidence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(MemberType type) {
            this.type = type;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder performance(ModelPerformance performance) {
            this.performance = performance;
            return this;
        }

        public Builder prediction(double prediction) {
            this.predictions.add(prediction);
            return this;
        }

        public Builder predictions(List<Double> predictions) {
            this.predictions.clear();
            this.predictions.addAll(predictions);
            return this;
        }

        /**
         * @param confidence self-reported confidence, or {@code null} to fall
         *                   back to {@link ModelPerformance#getR2()}
         */
        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public EnsembleMember build() {
            return new EnsembleMember(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public MemberType getType() {
        return type;
    }

    public double getWeight() {
        return weight;
    }

    public ModelPerformance getPerformance() {
        return performance;
    }

    public List<Double> getPredictions() {
        return predictions;
    }

    /** @return explicit confidence, {@code null} when not reported */
    public Double getConfidence() {
        return confidence;
    }

    double firstPrediction() {
        return predictions.get(0);
    }

    double effectiveConfidence() {
        return confidence != null ? confidence : performance.getR2();
    }

    /**
     * @return a copy of this member carrying {@code newWeight}
     */
    public EnsembleMember withWeight(double newWeight) {
        return builder()
                .id(id)
                .name(name)
                .type(type)
                .weight(newWeight)
                .performance(performance)
                .predictions(predictions)
                .confidence(confidence)
                .build();
    }

    @Override
    public String toString() {
        return "EnsembleMember{" +
                "id='" + id + '\'' +
                ", type=" + type.getKey() +
                ", weight=" + weight +
                ", prediction=" + firstPrediction() +
                ", confidence=" + confidence +
                '}';
    }
}
