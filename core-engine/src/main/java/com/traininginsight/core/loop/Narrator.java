package com.traininginsight.core.loop;

import com.traininginsight.core.bayesian.BayesianModel;
import com.traininginsight.core.bayesian.BayesianUpdater;
import com.traininginsight.core.bayesian.DriftReport;
import com.traininginsight.core.detection.DataQualityReport;
import com.traininginsight.core.ensemble.EnsemblePrediction;
import com.traininginsight.core.feature.FeatureEngineer;
import com.traininginsight.core.model.TargetVariable;
import com.traininginsight.core.regression.RegressionModel;
import com.traininginsight.core.trend.TrendAnalysis;
import com.traininginsight.core.trend.TrendDirection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns a run's numbers into short recommendations and insights.
 */
final class Narrator {

    static final String INSUFFICIENT_DATA_RECOMMENDATION =
            "Need at least 5 clean data points for meaningful predictions";
    static final String INSUFFICIENT_DATA_INSIGHT =
            "Continue logging training data to enable statistical learning";
    static final String HIGH_UNCERTAINTY =
            "High prediction uncertainty detected. Models need more consistent data for accurate forecasting.";
    static final String NO_TREND = "No significant trend detected - training load is stable";

    static final double OUTLIER_PERCENT_ALERT = 10;
    static final double RELATIVE_UNCERTAINTY_ALERT = 0.3;
    private static final int TOP_FACTORS = 3;

    private Narrator() {
        // utility class
    }

    /**
     * @param drift drift report, {@code null} when no Bayesian member ran
     */
    static List<String> recommendations(TrendAnalysis trend, DataQualityReport quality,
                                        EnsemblePrediction prediction, DriftReport drift,
                                        TargetVariable target) {
        List<String> out = new ArrayList<>();

        double weekly = trend.getSlope() * 7;
        if (trend.getDirection() == TrendDirection.INCREASING) {
            out.add(String.format(Locale.ROOT,
                    "Training load trending upward (+%.1f %s/week). Monitor for overtraining signs.",
                    weekly, target.getUnit()));
        } else if (trend.getDirection() == TrendDirection.DECREASING) {
            out.add(String.format(Locale.ROOT,
                    "Training load decreasing (%.1f %s/week). Consider if this is intentional taper.",
                    weekly, target.getUnit()));
        }

        if (quality.getOutlierPercentage() > OUTLIER_PERCENT_ALERT) {
            out.add(String.format(Locale.ROOT,
                    "%.1f%% of data points are outliers. Review data quality or consider abnormal training days.",
                    quality.getOutlierPercentage()));
        }

        if (prediction.getUncertainty() > Math.abs(prediction.getValue()) * RELATIVE_UNCERTAINTY_ALERT) {
            out.add(HIGH_UNCERTAINTY);
        }

        if (drift != null && drift.hasDrift()) {
            out.add(drift.getRecommendation());
        }
        return out;
    }

    /**
     * @param bayesian posterior, {@code null} when the member was disabled
     */
    static List<String> insights(int sessions, DataQualityReport quality, RegressionModel regression,
                                 BayesianModel bayesian, TrendAnalysis trend) {
        List<String> out = new ArrayList<>();

        out.add(String.format(Locale.ROOT,
                "Model trained on %d sessions with %d outliers removed (%.1f%%).",
                sessions, quality.getOutlierIndices().size(), quality.getOutlierPercentage()));

        double r2 = regression.getR2Score();
        out.add(String.format(Locale.ROOT, "Regression R² score: %.1f%% (%s fit)", r2 * 100, fitLabel(r2)));

        if (bayesian != null) {
            out.add(String.format(Locale.ROOT,
                    "Bayesian model confidence: %.1f%% based on %d observations",
                    BayesianUpdater.confidence(bayesian) * 100, bayesian.getObservations()));
        }

        if (trend.isSignificant()) {
            out.add(String.format(Locale.ROOT,
                    "Statistically significant %s trend detected (p=%.3f)",
                    trend.getDirection().getKey(), trend.getPValue()));
        } else {
            out.add(NO_TREND);
        }

        out.add("Top predictive factors: " + topFactors(regression.getCoefficients()));
        return out;
    }

    static String fitLabel(double r2) {
        if (r2 >= 0.7) {
            return "excellent";
        }
        return r2 >= 0.5 ? "good" : "fair";
    }

    private static String topFactors(double[] coefficients) {
        return IntStream.range(0, coefficients.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> -Math.abs(coefficients[i])))
                .limit(TOP_FACTORS)
                .map(i -> String.format(Locale.ROOT, "%s (%.2f)", featureName(i), Math.abs(coefficients[i])))
                .collect(Collectors.joining(", "));
    }

    private static String featureName(int index) {
        return index < FeatureEngineer.FEATURE_NAMES.size()
                ? FeatureEngineer.FEATURE_NAMES.get(index)
                : "feature " + index;
    }
}
