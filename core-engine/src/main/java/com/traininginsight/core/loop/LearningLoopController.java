package com.traininginsight.core.loop;

import com.traininginsight.core.bayesian.BayesianModel;
import com.traininginsight.core.bayesian.BayesianUpdater;
import com.traininginsight.core.bayesian.DriftReport;
import com.traininginsight.core.config.LearningConfig;
import com.traininginsight.core.detection.DataQualityAnalyzer;
import com.traininginsight.core.detection.DataQualityReport;
import com.traininginsight.core.ensemble.EnsembleBuilder;
import com.traininginsight.core.ensemble.EnsembleCombiner;
import com.traininginsight.core.ensemble.EnsembleMember;
import com.traininginsight.core.ensemble.EnsemblePrediction;
import com.traininginsight.core.ensemble.MemberType;
import com.traininginsight.core.ensemble.ModelPerformance;
import com.traininginsight.core.feature.FeatureEngineer;
import com.traininginsight.core.forecast.ForecastResult;
import com.traininginsight.core.forecast.TimeSeriesForecaster;
import com.traininginsight.core.model.DataPoint;
import com.traininginsight.core.model.Observation;
import com.traininginsight.core.model.TargetVariable;
import com.traininginsight.core.model.TimeSeriesPoint;
import com.traininginsight.core.regression.RegressionFitter;
import com.traininginsight.core.regression.RegressionModel;
import com.traininginsight.core.trend.TrendAnalysis;
import com.traininginsight.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the full learning pipeline over one athlete's history.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li>Preprocessing: flag outliers in the target series and drop them</li>
 * <li>Feature engineering on the clean sessions</li>
 * <li>Trend analysis</li>
 * <li>Model fitting: time-weighted regression and the Bayesian posterior</li>
 * <li>Ensemble assembly: time-series members join only above the configured
 * confidence bar</li>
 * <li>Prediction for the most recent session's features</li>
 * <li>Narration</li>
 * </ol>
 * <p>
 * With fewer than {@code minCleanPoints} clean sessions the run stops after
 * preprocessing and returns an {@value EnsemblePrediction#INSUFFICIENT_DATA}
 * result.
 * </p>
 *
 * <p>
 * Recency weights are measured from a reference instant. By default that is
 * the latest session timestamp, so a run depends only on its input; a
 * controller built with a {@link Clock} measures from the clock instead.
 * Runs are independent and may execute concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class LearningLoopController {

    private static final Logger LOG = LoggerFactory.getLogger(LearningLoopController.class);

    public static final String REGRESSION_MEMBER_ID = "regression_time_weighted";
    public static final String BAYESIAN_MEMBER_ID = "bayesian_adaptive";
    public static final String SMOOTHING_MEMBER_ID = "exponential_smoothing";
    public static final String MOVING_AVERAGE_MEMBER_ID = "moving_average";

    private final LearningConfig config;
    /** {@code null} when the reference instant is the latest session. */
    private final Clock clock;

    public LearningLoopController() {
        this(LearningConfig.defaults());
    }

    /**
     * Controller anchored on the latest session timestamp of each run.
     *
     * @param config validated on construction
     * @throws IllegalStateException if {@code config} is invalid
     */
    public LearningLoopController(LearningConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = null;
        config.validate();
    }

    /**
     * Controller measuring recency from wall-clock (or test) time.
     *
     * @param config validated on construction
     * @param clock  source of the reference instant for recency weighting
     * @throws IllegalStateException if {@code config} is invalid
     */
    public LearningLoopController(LearningConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        config.validate();
    }

    public LearningConfig getConfig() {
        return config;
    }

    /**
     * Run without any record of earlier prediction errors.
     */
    public LearningLoopResult runLearningLoop(List<Observation> observations, TargetVariable target) {
        return runLearningLoop(observations, target, PredictionHistory.empty());
    }

    /**
     * Run the pipeline.
     *
     * @param observations training history in any order; not modified
     * @param target       variable to predict
     * @param history      errors from earlier runs, for adaptive weighting and
     *                     drift detection
     * @return prediction, state and narration
     */
    public LearningLoopResult runLearningLoop(List<Observation> observations, TargetVariable target,
                                              PredictionHistory history) {
        Objects.requireNonNull(observations, "observations must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(history, "history must not be null");

        Instant now = referenceInstant(observations);
        LOG.info("Learning run started: {} observation(s), target '{}'", observations.size(), target.getKey());

        // ---------------------------------------------------------------
        // Preprocessing
        // ---------------------------------------------------------------
        double[] targets = new double[observations.size()];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = target.valueOf(observations.get(i));
        }
        DataQualityReport quality = DataQualityAnalyzer.generateReport(targets, config.resolveOutlierMethod());

        Set<Integer> flagged = new HashSet<>(quality.getOutlierIndices());
        List<Observation> clean = new ArrayList<>(observations.size() - flagged.size());
        for (int i = 0; i < observations.size(); i++) {
            if (!flagged.contains(i)) {
                clean.add(observations.get(i));
            }
        }

        if (clean.size() < config.getMinCleanPoints()) {
            LOG.info("Learning run stopped early: {} clean point(s) < {}", clean.size(), config.getMinCleanPoints());
            return new LearningLoopResult(
                    LearningState.empty(quality, now),
                    EnsemblePrediction.unavailable(EnsemblePrediction.INSUFFICIENT_DATA),
                    List.of(Narrator.INSUFFICIENT_DATA_RECOMMENDATION),
                    List.of(Narrator.INSUFFICIENT_DATA_INSIGHT));
        }

        // ---------------------------------------------------------------
        // Features and trend
        // ---------------------------------------------------------------
        FeatureEngineer engineer = new FeatureEngineer(config.resolveZone(), config.getRecencyDecayDays());
        List<DataPoint> points = engineer.engineer(clean, target, now);

        List<TimeSeriesPoint> series = new ArrayList<>(clean.size());
        for (Observation o : clean) {
            series.add(new TimeSeriesPoint(o.getTimestamp(), target.valueOf(o)));
        }
        series.sort(Comparator.comparing(TimeSeriesPoint::getTimestamp));
        TrendAnalysis trend = TrendAnalyzer.detectTrend(series);

        // ---------------------------------------------------------------
        // Model fitting
        // ---------------------------------------------------------------
        RegressionModel regression = new RegressionFitter(Clock.fixed(now, ZoneOffset.UTC))
                .fitTimeWeighted(points, config.getHalfLifeDays());
        LOG.debug("Time-weighted regression: r2={} mse={}", regression.getR2Score(), regression.getMse());

        double[] latest = latestFeatures(points);
        EnsembleBuilder members = new EnsembleBuilder()
                .add(EnsembleMember.builder()
                        .id(REGRESSION_MEMBER_ID)
                        .name("Time-Weighted Regression")
                        .type(MemberType.REGRESSION)
                        .performance(new ModelPerformance(regression.getMae(), regression.getMse(),
                                regression.getR2Score(), regression.getR2Score()))
                        .prediction(regression.predict(latest))
                        .confidence(regression.getR2Score())
                        .build());

        BayesianModel bayesian = null;
        DriftReport drift = null;
        if (config.isIncludeBayesian()) {
            bayesian = BayesianUpdater.batchUpdate(BayesianUpdater.initialize(FeatureEngineer.FEATURE_COUNT), points);
            double confidence = BayesianUpdater.confidence(bayesian);
            members.add(EnsembleMember.builder()
                    .id(BAYESIAN_MEMBER_ID)
                    .name("Bayesian Adaptive Model")
                    .type(MemberType.BAYESIAN)
                    .performance(new ModelPerformance(0, 0, confidence, confidence))
                    .prediction(BayesianUpdater.predict(bayesian, latest).getMean())
                    .confidence(confidence)
                    .build());
            drift = BayesianUpdater.detectDrift(bayesian, history.getBayesianResiduals());
        }

        if (config.isIncludeTimeSeries()) {
            ForecastResult smoothing = TimeSeriesForecaster.tripleExponentialSmoothing(series,
                    config.getSmoothingAlpha(), config.getSmoothingBeta(), config.getForecastHorizon());
            addForecastMember(members, SMOOTHING_MEMBER_ID, "Exponential Smoothing", smoothing);

            ForecastResult movingAverage = TimeSeriesForecaster.adaptiveMovingAverage(series,
                    config.getForecastHorizon());
            addForecastMember(members, MOVING_AVERAGE_MEMBER_ID, "Adaptive Moving Average", movingAverage);
        }

        // ---------------------------------------------------------------
        // Ensemble prediction
        // ---------------------------------------------------------------
        List<EnsembleMember> ensemble = members.build();
        EnsembleCombiner combiner = new EnsembleCombiner(config.getMinModels());
        EnsemblePrediction prediction = combiner.combine(ensemble, config.resolveEnsembleStrategy(),
                history.getModelErrors());
        LOG.debug("Ensemble of {} member(s), diversity {}: {}", ensemble.size(), combiner.diversity(ensemble), prediction);

        // ---------------------------------------------------------------
        // Narration and state
        // ---------------------------------------------------------------
        List<String> recommendations = Narrator.recommendations(trend, quality, prediction, drift, target);
        List<String> insights = Narrator.insights(clean.size(), quality, regression, bayesian, trend);

        LearningState state = new LearningState(quality, trend, regression, bayesian, ensemble,
                new PerformanceSummary(regression.getMae(), regression.getMse(), regression.getR2Score(),
                        prediction.getConfidence()),
                clean.size(), now);

        LOG.info("Learning run finished: value={} method={} confidence={}",
                prediction.getValue(), prediction.getMethod(), prediction.getConfidence());
        return new LearningLoopResult(state, prediction, recommendations, insights);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void addForecastMember(EnsembleBuilder members, String id, String name, ForecastResult forecast) {
        if (forecast.isEmpty()) {
            LOG.debug("Forecast '{}' produced no predictions", id);
            return;
        }
        double confidence = forecast.getConfidence();
        members.addIfConfident(EnsembleMember.builder()
                .id(id)
                .name(name)
                .type(MemberType.TIME_SERIES)
                .weight(confidence)
                .performance(new ModelPerformance(0, 0, confidence, confidence))
                .predictions(forecast.getPredictions())
                .confidence(confidence)
                .build(), config.getTimeSeriesConfidenceThreshold());
    }

    /**
     * Clock instant when one was supplied, otherwise the latest session
     * timestamp ({@link Instant#EPOCH} for an empty history).
     */
    private Instant referenceInstant(List<Observation> observations) {
        if (clock != null) {
            return clock.instant();
        }
        Instant latest = null;
        for (Observation o : observations) {
            if (latest == null || o.getTimestamp().isAfter(latest)) {
                latest = o.getTimestamp();
            }
        }
        return latest != null ? latest : Instant.EPOCH;
    }

    /**
     * Features of the most recent session; the last one in input order wins
     * a tie.
     */
    private static double[] latestFeatures(List<DataPoint> points) {
        DataPoint latest = points.get(0);
        for (DataPoint p : points) {
            if (!p.getTimestamp().isBefore(latest.getTimestamp())) {
                latest = p;
            }
        }
        return latest.getFeatures();
    }
}
