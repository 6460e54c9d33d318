package com.traininginsight.core.loop;

import com.traininginsight.core.ensemble.EnsemblePrediction;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Output of {@link LearningLoopController#runLearningLoop}: the forecast,
 * the state behind it, and narration for the athlete.
 *
 * @since 1.0.0
 */
public final class LearningLoopResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LearningState state;
    private final EnsemblePrediction prediction;
    private final List<String> recommendations;
    private final List<String> insights;

    public LearningLoopResult(LearningState state, EnsemblePrediction prediction,
                              List<String> recommendations, List<String> insights) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.prediction = Objects.requireNonNull(prediction, "prediction must not be null");
        this.recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations must not be null"));
        this.insights = List.copyOf(Objects.requireNonNull(insights, "insights must not be null"));
    }

    public LearningState getState() {
        return state;
    }

    public EnsemblePrediction getPrediction() {
        return prediction;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public List<String> getInsights() {
        return insights;
    }

    @Override
    public String toString() {
        return "LearningLoopResult{" +
                "prediction=" + prediction +
                ", recommendations=" + recommendations.size() +
                ", insights=" + insights.size() +
                '}';
    }
}
