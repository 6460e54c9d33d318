package com.traininginsight.core.loop;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Errors observed after earlier runs, supplied by the caller.
 *
 * <p>
 * The engine keeps no state between runs; a caller that records how past
 * predictions turned out can pass them back here to drive adaptive ensemble
 * weighting and Bayesian drift detection.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictionHistory implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final PredictionHistory EMPTY =
            new PredictionHistory(Collections.emptyMap(), Collections.emptyList());

    private final Map<String, List<Double>> modelErrors;
    private final List<Double> bayesianResiduals;

    /**
     * @param modelErrors       recent signed errors keyed by ensemble member id
     * @param bayesianResiduals recent residuals of the Bayesian member
     */
    public PredictionHistory(Map<String, List<Double>> modelErrors, List<Double> bayesianResiduals) {
        Objects.requireNonNull(modelErrors, "modelErrors must not be null");
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        modelErrors.forEach((id, errors) -> copy.put(id, List.copyOf(errors)));
        this.modelErrors = Collections.unmodifiableMap(copy);
        this.bayesianResiduals = List.copyOf(
                Objects.requireNonNull(bayesianResiduals, "bayesianResiduals must not be null"));
    }

    /**
     * @return a history with no recorded errors
     */
    public static PredictionHistory empty() {
        return EMPTY;
    }

    public Map<String, List<Double>> getModelErrors() {
        return modelErrors;
    }

    public List<Double> getBayesianResiduals() {
        return bayesianResiduals;
    }

    @Override
    public String toString() {
        return "PredictionHistory{models=" + modelErrors.keySet()
                + ", bayesianResiduals=" + bayesianResiduals.size() + '}';
    }
}
