package com.traininginsight.core.loop;

import com.traininginsight.core.bayesian.BayesianModel;
import com.traininginsight.core.detection.DataQualityReport;
import com.traininginsight.core.ensemble.EnsembleMember;
import com.traininginsight.core.regression.RegressionModel;
import com.traininginsight.core.trend.TrendAnalysis;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything one learning run produced besides the prediction itself.
 *
 * <p>
 * Built fresh by every run and never persisted by the engine. The models are
 * {@code null} when the run stopped early or the member was disabled.
 * </p>
 *
 * @since 1.0.0
 */
public final class LearningState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DataQualityReport dataQuality;
    private final TrendAnalysis trendAnalysis;
    private final RegressionModel regressionModel;
    private final BayesianModel bayesianModel;
    private final List<EnsembleMember> ensembleMembers;
    private final PerformanceSummary performance;
    private final int observationCount;
    private final Instant lastUpdated;

    public LearningState(DataQualityReport dataQuality, TrendAnalysis trendAnalysis,
                         RegressionModel regressionModel, BayesianModel bayesianModel,
                         List<EnsembleMember> ensembleMembers, PerformanceSummary performance,
                         int observationCount, Instant lastUpdated) {
        this.dataQuality = Objects.requireNonNull(dataQuality, "dataQuality must not be null");
        this.trendAnalysis = Objects.requireNonNull(trendAnalysis, "trendAnalysis must not be null");
        this.regressionModel = regressionModel;
        this.bayesianModel = bayesianModel;
        this.ensembleMembers = List.copyOf(Objects.requireNonNull(ensembleMembers, "ensembleMembers must not be null"));
        this.performance = Objects.requireNonNull(performance, "performance must not be null");
        this.observationCount = observationCount;
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
    }

    /**
     * State of a run that stopped before fitting.
     */
    static LearningState empty(DataQualityReport dataQuality, Instant now) {
        return new LearningState(dataQuality, TrendAnalysis.none(), null, null,
                Collections.emptyList(), PerformanceSummary.NONE, 0, now);
    }

    public DataQualityReport getDataQuality() {
        return dataQuality;
    }

    public TrendAnalysis getTrendAnalysis() {
        return trendAnalysis;
    }

    /** @return the time-weighted fit, or {@code null} */
    public RegressionModel getRegressionModel() {
        return regressionModel;
    }

    /** @return the Bayesian posterior, or {@code null} */
    public BayesianModel getBayesianModel() {
        return bayesianModel;
    }

    public List<EnsembleMember> getEnsembleMembers() {
        return ensembleMembers;
    }

    public PerformanceSummary getPerformance() {
        return performance;
    }

    /** @return clean observations used for fitting */
    public int getObservationCount() {
        return observationCount;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "LearningState{" +
                "observations=" + observationCount +
                ", trend=" + trendAnalysis +
                ", members=" + ensembleMembers.size() +
                ", performance=" + performance +
                '}';
    }
}
