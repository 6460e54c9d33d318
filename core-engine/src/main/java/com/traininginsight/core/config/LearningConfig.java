package com.traininginsight.core.config;

import com.traininginsight.core.detection.OutlierMethod;
import com.traininginsight.core.ensemble.EnsembleStrategy;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tunables of a learning run, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * outlierMethod: modified_z_score
 * minCleanPoints: 5
 * halfLifeDays: 30
 * recencyDecayDays: 30
 * smoothingAlpha: 0.3
 * smoothingBeta: 0.1
 * forecastHorizon: 1
 * timeSeriesConfidenceThreshold: 0.3
 * ensembleMethod: adaptive
 * minModels: 2
 * includeBayesian: true
 * includeTimeSeries: true
 * zoneId: UTC
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class LearningConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Preprocessing ---
    /** Univariate detector used to clean the target series. */
    private String outlierMethod = "modified_z_score";

    /** Clean points required before any model is fitted. */
    private int minCleanPoints = 5;

    // --- Fitting ---
    /** Half-life of the time-weighted regression, in days. */
    private double halfLifeDays = 30;

    /** Scale of the feature recency weight, in days. */
    private double recencyDecayDays = 30;

    // --- Forecasting ---
    private double smoothingAlpha = 0.3;
    private double smoothingBeta = 0.1;
    private int forecastHorizon = 1;

    /** Self-confidence a time-series member must exceed to join the ensemble. */
    private double timeSeriesConfidenceThreshold = 0.3;

    // --- Ensemble ---
    private String ensembleMethod = "adaptive";
    private int minModels = 2;
    private boolean includeBayesian = true;
    private boolean includeTimeSeries = true;

    /** Zone in which the day of week is derived. */
    private String zoneId = "UTC";

    /**
     * @return a configuration holding every default
     */
    public static LearningConfig defaults() {
        return new LearningConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every field, reporting all problems at once.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            if (!OutlierMethod.fromKey(outlierMethod).isUnivariate()) {
                errors.add("'outlierMethod' must be a univariate method, got: " + outlierMethod);
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add(e.getMessage());
        }
        try {
            EnsembleStrategy.fromKey(ensembleMethod);
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add(e.getMessage());
        }
        try {
            ZoneId.of(zoneId);
        } catch (DateTimeException | NullPointerException e) {
            errors.add("'zoneId' is invalid: " + zoneId);
        }

        if (minCleanPoints < 1) {
            errors.add("'minCleanPoints' must be >= 1");
        }
        if (halfLifeDays <= 0) {
            errors.add("'halfLifeDays' must be > 0");
        }
        if (recencyDecayDays <= 0) {
            errors.add("'recencyDecayDays' must be > 0");
        }
        if (smoothingAlpha <= 0 || smoothingAlpha > 1) {
            errors.add("'smoothingAlpha' must be in (0, 1]");
        }
        if (smoothingBeta < 0 || smoothingBeta > 1) {
            errors.add("'smoothingBeta' must be in [0, 1]");
        }
        if (forecastHorizon < 1) {
            errors.add("'forecastHorizon' must be >= 1");
        }
        if (timeSeriesConfidenceThreshold < 0 || timeSeriesConfidenceThreshold > 1) {
            errors.add("'timeSeriesConfidenceThreshold' must be in [0, 1]");
        }
        if (minModels < 1) {
            errors.add("'minModels' must be >= 1");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Learning configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public OutlierMethod resolveOutlierMethod() {
        return OutlierMethod.fromKey(outlierMethod);
    }

    public EnsembleStrategy resolveEnsembleStrategy() {
        return EnsembleStrategy.fromKey(ensembleMethod);
    }

    public ZoneId resolveZone() {
        return ZoneId.of(zoneId);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getOutlierMethod() {
        return outlierMethod;
    }

    public void setOutlierMethod(String outlierMethod) {
        this.outlierMethod = outlierMethod != null ? outlierMethod.toLowerCase(Locale.ROOT) : null;
    }

    public int getMinCleanPoints() {
        return minCleanPoints;
    }

    public void setMinCleanPoints(int minCleanPoints) {
        this.minCleanPoints = minCleanPoints;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public void setHalfLifeDays(double halfLifeDays) {
        this.halfLifeDays = halfLifeDays;
    }

    public double getRecencyDecayDays() {
        return recencyDecayDays;
    }

    public void setRecencyDecayDays(double recencyDecayDays) {
        this.recencyDecayDays = recencyDecayDays;
    }

    public double getSmoothingAlpha() {
        return smoothingAlpha;
    }

    public void setSmoothingAlpha(double smoothingAlpha) {
        this.smoothingAlpha = smoothingAlpha;
    }

    public double getSmoothingBeta() {
        return smoothingBeta;
    }

    public void setSmoothingBeta(double smoothingBeta) {
        this.smoothingBeta = smoothingBeta;
    }

    public int getForecastHorizon() {
        return forecastHorizon;
    }

    public void setForecastHorizon(int forecastHorizon) {
        this.forecastHorizon = forecastHorizon;
    }

    public double getTimeSeriesConfidenceThreshold() {
        return timeSeriesConfidenceThreshold;
    }

    public void setTimeSeriesConfidenceThreshold(double timeSeriesConfidenceThreshold) {
        this.timeSeriesConfidenceThreshold = timeSeriesConfidenceThreshold;
    }

    public String getEnsembleMethod() {
        return ensembleMethod;
    }

    public void setEnsembleMethod(String ensembleMethod) {
        this.ensembleMethod = ensembleMethod != null ? ensembleMethod.toLowerCase(Locale.ROOT) : null;
    }

    public int getMinModels() {
        return minModels;
    }

    public void setMinModels(int minModels) {
        this.minModels = minModels;
    }

    public boolean isIncludeBayesian() {
        return includeBayesian;
    }

    public void setIncludeBayesian(boolean includeBayesian) {
        this.includeBayesian = includeBayesian;
    }

    public boolean isIncludeTimeSeries() {
        return includeTimeSeries;
    }

    public void setIncludeTimeSeries(boolean includeTimeSeries) {
        this.includeTimeSeries = includeTimeSeries;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    @Override
    public String toString() {
        return "LearningConfig{" +
                "outlierMethod='" + outlierMethod + '\'' +
                ", minCleanPoints=" + minCleanPoints +
                ", halfLifeDays=" + halfLifeDays +
                ", recencyDecayDays=" + recencyDecayDays +
                ", smoothingAlpha=" + smoothingAlpha +
                ", smoothingBeta=" + smoothingBeta +
                ", forecastHorizon=" + forecastHorizon +
                ", timeSeriesConfidenceThreshold=" + timeSeriesConfidenceThreshold +
                ", ensembleMethod='" + ensembleMethod + '\'' +
                ", minModels=" + minModels +
                ", includeBayesian=" + includeBayesian +
                ", includeTimeSeries=" + includeTimeSeries +
                ", zoneId='" + zoneId + '\'' +
                '}';
    }
}
