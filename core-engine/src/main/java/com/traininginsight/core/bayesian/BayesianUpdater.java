package com.traininginsight.core.bayesian;

import com.traininginsight.core.math.Matrices;
import com.traininginsight.core.model.DataPoint;
import com.traininginsight.core.model.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Closed-form Bayesian linear regression with a Normal-Gamma conjugate
 * prior.
 *
 * <h3>Model</h3>
 * <pre>
 *   Prior:   μ₀ = 0 (or supplied), Λ₀ = I / priorVariance, α₀ = β₀ = 1
 *   Update:  Λ' = Λ + w·x·xᵀ
 *            μ' = Λ'⁻¹ (Λμ + w·x·y)
 *            α' = α + w/2
 *            β' = β + w·(y - xᵀμ)²/2
 * </pre>
 *
 * <p>
 * Each update costs one small matrix inversion and is deterministic; no
 * sampling is involved. Pure static utility, no state.
 * </p>
 *
 * @since 1.0.0
 */
public final class BayesianUpdater {

    private static final Logger LOG = LoggerFactory.getLogger(BayesianUpdater.class);

    static final double DEFAULT_PRIOR_VARIANCE = 1000;
    static final double DEFAULT_DRIFT_THRESHOLD = 2.0;
    static final int MIN_DRIFT_RESIDUALS = 5;

    /** Observations at which the observation-count confidence saturates. */
    static final double CONFIDENCE_SATURATION = 100;

    private static final double Z_95 = 1.96;

    private BayesianUpdater() {
        // utility class
    }

    /**
     * Weak zero-mean prior.
     *
     * @param featureCount number of coefficients; must be positive
     */
    public static BayesianModel initialize(int featureCount) {
        if (featureCount <= 0) {
            throw new IllegalArgumentException("featureCount must be > 0, got: " + featureCount);
        }
        return initialize(featureCount, new double[featureCount], DEFAULT_PRIOR_VARIANCE);
    }

    /**
     * Prior with explicit mean and isotropic variance.
     *
     * @param featureCount  number of coefficients
     * @param priorMean     prior coefficient mean, length {@code featureCount}
     * @param priorVariance prior coefficient variance; large means weak
     */
    public static BayesianModel initialize(int featureCount, double[] priorMean, double priorVariance) {
        Objects.requireNonNull(priorMean, "priorMean must not be null");
        if (priorMean.length != featureCount) {
            throw new IllegalArgumentException("priorMean has " + priorMean.length
                    + " entries, expected " + featureCount);
        }
        if (priorVariance <= 0) {
            throw new IllegalArgumentException("priorVariance must be > 0, got: " + priorVariance);
        }

        double[][] precision = new double[featureCount][featureCount];
        for (int i = 0; i < featureCount; i++) {
            precision[i][i] = 1 / priorVariance;
        }
        NormalGamma prior = new NormalGamma(priorMean, precision, 1.0, 1.0);

        double[] uncertainty = new double[featureCount];
        Arrays.fill(uncertainty, 1.0);
        List<Interval> intervals = new ArrayList<>(featureCount);
        for (int i = 0; i < featureCount; i++) {
            intervals.add(Interval.UNBOUNDED);
        }
        return new BayesianModel(prior, prior, uncertainty, intervals, 0);
    }

    /**
     * Fold one observation into the posterior.
     *
     * @param model    current state; not modified
     * @param features feature vector, length {@link BayesianModel#getFeatureCount()}
     * @param target   observed value
     * @param weight   observation weight, {@code >= 0}
     * @return a new model
     */
    public static BayesianModel update(BayesianModel model, double[] features, double target, double weight) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(features, "features must not be null");
        int n = model.getFeatureCount();
        if (features.length != n) {
            throw new IllegalArgumentException("Model has " + n + " features, got " + features.length);
        }
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0, got: " + weight);
        }

        NormalGamma posterior = model.getPosterior();
        double[][] oldPrecision = posterior.precisionView();
        double[] oldMean = posterior.meanView();

        double[][] newPrecision = Matrices.copy(oldPrecision);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                newPrecision[i][j] += weight * features[i] * features[j];
            }
        }

        double[] rhs = Matrices.multiply(oldPrecision, oldMean);
        for (int i = 0; i < n; i++) {
            rhs[i] += weight * features[i] * target;
        }

        double[][] covariance = Matrices.invertOrIdentity(newPrecision);
        double[] newMean = Matrices.multiply(covariance, rhs);

        double error = target - Matrices.dot(features, oldMean);
        double newAlpha = posterior.getAlpha() + 0.5 * weight;
        double newBeta = posterior.getBeta() + 0.5 * weight * error * error;

        double expectedNoisePrecision = newAlpha / newBeta;
        double[] uncertainty = new double[n];
        List<Interval> intervals = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            uncertainty[i] = Math.sqrt(Math.abs(covariance[i][i] / expectedNoisePrecision));
            intervals.add(Interval.around(newMean[i], Z_95 * uncertainty[i]));
        }

        return new BayesianModel(model.getPrior(),
                new NormalGamma(newMean, newPrecision, newAlpha, newBeta),
                uncertainty, intervals, model.getObservations() + 1);
    }

    /**
     * Unit-weight update.
     */
    public static BayesianModel update(BayesianModel model, double[] features, double target) {
        return update(model, features, target, 1.0);
    }

    /**
     * Fold every data point, in order, using each point's weight.
     */
    public static BayesianModel batchUpdate(BayesianModel model, List<DataPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        BayesianModel current = model;
        for (DataPoint p : points) {
            current = update(current, p.getFeatures(), p.getTarget(), p.getWeight());
        }
        LOG.debug("Bayesian posterior after {} update(s): alpha={} beta={}",
                points.size(), current.getPosterior().getAlpha(), current.getPosterior().getBeta());
        return current;
    }

    /**
     * Posterior predictive mean and variance
     * {@code σ² + xᵀΛ⁻¹x} with {@code σ² = β/(α-1)}.
     *
     * <p>
     * Before the shape exceeds 1 the noise variance is undefined and reported
     * as infinite, giving an unbounded credible interval.
     * </p>
     */
    public static BayesianPrediction predict(BayesianModel model, double[] features) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(features, "features must not be null");
        NormalGamma posterior = model.getPosterior();
        if (features.length != posterior.dimension()) {
            throw new IllegalArgumentException("Model has " + posterior.dimension()
                    + " features, got " + features.length);
        }

        double mean = Matrices.dot(features, posterior.meanView());
        double noiseVariance = posterior.getAlpha() > 1
                ? posterior.getBeta() / (posterior.getAlpha() - 1)
                : Double.POSITIVE_INFINITY;
        double modelVariance = Matrices.quadraticForm(features, Matrices.invertOrIdentity(posterior.precisionView()));
        double variance = noiseVariance + modelVariance;

        Interval interval = Double.isInfinite(variance)
                ? Interval.UNBOUNDED
                : Interval.around(mean, Z_95 * Math.sqrt(variance));
        return new BayesianPrediction(mean, variance, interval);
    }

    /**
     * Confidence in [0, 1]: grows with the observation count (saturating at
     * {@value #CONFIDENCE_SATURATION}) and shrinks with mean coefficient
     * uncertainty.
     */
    public static double confidence(BayesianModel model) {
        Objects.requireNonNull(model, "model must not be null");
        double observationConfidence = Math.min(model.getObservations() / CONFIDENCE_SATURATION, 1.0);
        double uncertaintyConfidence = 1 / (1 + model.meanUncertainty());
        return observationConfidence * uncertaintyConfidence;
    }

    /**
     * Drift check with the default severity threshold.
     */
    public static DriftReport detectDrift(BayesianModel model, List<Double> recentResiduals) {
        return detectDrift(model, recentResiduals, DEFAULT_DRIFT_THRESHOLD);
    }

    /**
     * Compare the variance of recent residuals with the noise variance the
     * posterior expects ({@code β/α}).
     *
     * @param model           fitted model
     * @param recentResiduals prediction errors observed after fitting
     * @param threshold       severity above which drift is reported
     * @return drift report; at least {@value #MIN_DRIFT_RESIDUALS} residuals
     *         are needed for a verdict
     */
    public static DriftReport detectDrift(BayesianModel model, List<Double> recentResiduals, double threshold) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(recentResiduals, "recentResiduals must not be null");
        if (recentResiduals.size() < MIN_DRIFT_RESIDUALS) {
            return new DriftReport(false, 0, "Insufficient data for drift detection");
        }

        NormalGamma posterior = model.getPosterior();
        double expectedNoise = posterior.getBeta() / posterior.getAlpha();

        double mean = 0;
        for (double e : recentResiduals) {
            mean += e;
        }
        mean /= recentResiduals.size();
        double actualVariance = 0;
        for (double e : recentResiduals) {
            actualVariance += (e - mean) * (e - mean);
        }
        actualVariance /= recentResiduals.size();

        double severity = actualVariance / expectedNoise;
        boolean drift = severity > threshold;

        String recommendation;
        if (!drift) {
            recommendation = "Model performing well - no drift detected";
        } else if (severity > 5) {
            recommendation = "Critical drift detected - recommend full model reset with recent data";
        } else if (severity > 3) {
            recommendation = "Significant drift - increase learning rate or add more recent observations";
        } else {
            recommendation = "Mild drift - continue monitoring";
        }
        if (drift) {
            LOG.warn("Model drift detected: severity={} over {} residual(s)", severity, recentResiduals.size());
        }
        return new DriftReport(drift, severity, recommendation);
    }
}
