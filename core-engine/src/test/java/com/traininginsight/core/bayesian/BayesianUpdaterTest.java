package com.traininginsight.core.bayesian;

import com.traininginsight.core.model.DataPoint;
import com.traininginsight.core.model.Interval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BayesianUpdater}.
 */
class BayesianUpdaterTest {

    @Test
    @DisplayName("Should start from a weak zero-mean prior with unbounded intervals")
    void shouldInitializeWeakPrior() {
        BayesianModel model = BayesianUpdater.initialize(3);

        assertThat(model.getCoefficients()).containsExactly(0, 0, 0);
        assertThat(model.getUncertainty()).containsExactly(1, 1, 1);
        assertThat(model.getCredibleIntervals()).containsOnly(Interval.UNBOUNDED);
        assertThat(model.getObservations()).isZero();
        assertThat(model.getPosterior().getAlpha()).isEqualTo(1.0);
        assertThat(model.getPosterior().getBeta()).isEqualTo(1.0);
        assertThat(model.getPosterior().getPrecision()[1][1]).isCloseTo(1 / 1000.0, within(1e-15));
        assertThat(model.getPosterior().getPrecision()[0][1]).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive feature count or mismatched prior")
    void shouldRejectInvalidPrior() {
        assertThatThrownBy(() -> BayesianUpdater.initialize(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("featureCount");
        assertThatThrownBy(() -> BayesianUpdater.initialize(2, new double[]{1}, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BayesianUpdater.initialize(1, new double[]{1}, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Posterior mean should converge on noise-free linear data")
    void shouldConvergeOnLinearData() {
        BayesianModel model = BayesianUpdater.batchUpdate(BayesianUpdater.initialize(2), linearPoints(50));

        assertThat(model.getCoefficients()[0]).isCloseTo(2.0, within(0.01));
        assertThat(model.getCoefficients()[1]).isCloseTo(3.0, within(0.01));
        assertThat(model.getObservations()).isEqualTo(50);
        assertThat(model.getPosterior().getAlpha()).isEqualTo(26.0);
        assertThat(model.getCredibleIntervals().get(0).contains(2.0)).isTrue();
        assertThat(model.getCredibleIntervals().get(1).contains(3.0)).isTrue();
    }

    @Test
    @DisplayName("Update should return a new model and leave its input untouched")
    void updateShouldNotMutateInput() {
        BayesianModel prior = BayesianUpdater.initialize(2);

        BayesianModel posterior = BayesianUpdater.update(prior, new double[]{1, 2}, 8);

        assertThat(posterior).isNotSameAs(prior);
        assertThat(prior.getCoefficients()).containsExactly(0, 0);
        assertThat(prior.getObservations()).isZero();
        assertThat(posterior.getObservations()).isEqualTo(1);
        assertThat(posterior.getPrior()).isSameAs(prior.getPrior());
    }

    @Test
    @DisplayName("Batch update should equal folding the points one at a time")
    void batchUpdateShouldMatchSequentialUpdates() {
        List<DataPoint> points = linearPoints(10);

        BayesianModel sequential = BayesianUpdater.initialize(2);
        for (DataPoint p : points) {
            sequential = BayesianUpdater.update(sequential, p.getFeatures(), p.getTarget(), p.getWeight());
        }
        BayesianModel batch = BayesianUpdater.batchUpdate(BayesianUpdater.initialize(2), points);

        assertThat(batch.getCoefficients()).containsExactly(sequential.getCoefficients());
        assertThat(batch.getPosterior().getBeta()).isEqualTo(sequential.getPosterior().getBeta());
    }

    @Test
    @DisplayName("A zero-weight observation should leave the posterior parameters unchanged")
    void zeroWeightShouldNotMoveThePosterior() {
        BayesianModel prior = BayesianUpdater.initialize(2);

        BayesianModel updated = BayesianUpdater.update(prior, new double[]{3, 4}, 100, 0);

        assertThat(updated.getCoefficients()).containsExactly(0, 0);
        assertThat(updated.getPosterior().getAlpha()).isEqualTo(1.0);
        assertThat(updated.getPosterior().getBeta()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject mismatched feature vectors and negative weights")
    void shouldRejectInvalidUpdates() {
        BayesianModel model = BayesianUpdater.initialize(2);

        assertThatThrownBy(() -> BayesianUpdater.update(model, new double[]{1}, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("features");
        assertThatThrownBy(() -> BayesianUpdater.update(model, new double[]{1, 1}, 1, -0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("weight");
    }

    @Test
    @DisplayName("Prediction should be unbounded while the noise variance is undefined")
    void predictionShouldBeUnboundedForFreshModel() {
        BayesianPrediction prediction = BayesianUpdater.predict(BayesianUpdater.initialize(2), new double[]{1, 1});

        assertThat(prediction.getMean()).isZero();
        assertThat(prediction.getVariance()).isInfinite();
        assertThat(prediction.getCredibleInterval()).isEqualTo(Interval.UNBOUNDED);
    }

    @Test
    @DisplayName("Prediction should carry a finite 95% interval after fitting")
    void predictionShouldBeFiniteAfterFitting() {
        BayesianModel model = BayesianUpdater.batchUpdate(BayesianUpdater.initialize(2), linearPoints(50));

        BayesianPrediction prediction = BayesianUpdater.predict(model, new double[]{1, 1});

        assertThat(prediction.getMean()).isCloseTo(5.0, within(0.05));
        assertThat(prediction.getVariance()).isPositive().isFinite();
        Interval interval = prediction.getCredibleInterval();
        assertThat(interval.contains(prediction.getMean())).isTrue();
        assertThat(interval.getUpper() - prediction.getMean())
                .isCloseTo(1.96 * Math.sqrt(prediction.getVariance()), within(1e-9));
    }

    @Test
    @DisplayName("Confidence should be zero without observations and grow with data")
    void confidenceShouldGrowWithObservations() {
        BayesianModel fresh = BayesianUpdater.initialize(2);
        BayesianModel few = BayesianUpdater.batchUpdate(fresh, linearPoints(10));
        BayesianModel many = BayesianUpdater.batchUpdate(fresh, linearPoints(60));

        assertThat(BayesianUpdater.confidence(fresh)).isZero();
        assertThat(BayesianUpdater.confidence(few)).isPositive();
        assertThat(BayesianUpdater.confidence(many)).isGreaterThan(BayesianUpdater.confidence(few)).isLessThan(1.0);
    }

    // ---------------------------------------------------------------
    // Drift
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should not judge drift from fewer than five residuals")
    void shouldRequireFiveResiduals() {
        DriftReport report = BayesianUpdater.detectDrift(BayesianUpdater.initialize(1), List.of(9.0, -9.0, 9.0, -9.0));

        assertThat(report.hasDrift()).isFalse();
        assertThat(report.getSeverity()).isZero();
        assertThat(report.getRecommendation()).isEqualTo("Insufficient data for drift detection");
    }

    @Test
    @DisplayName("Residual variance in line with the posterior should report no drift")
    void shouldReportNoDrift() {
        DriftReport report = BayesianUpdater.detectDrift(BayesianUpdater.initialize(1), alternating(1.0));

        assertThat(report.hasDrift()).isFalse();
        assertThat(report.getSeverity()).isCloseTo(1.0, within(1e-12));
        assertThat(report.getRecommendation()).isEqualTo("Model performing well - no drift detected");
    }

    @Test
    @DisplayName("Severity bands should map to mild, significant and critical recommendations")
    void shouldGradeDriftSeverity() {
        BayesianModel model = BayesianUpdater.initialize(1);

        DriftReport mild = BayesianUpdater.detectDrift(model, alternating(1.5));
        DriftReport significant = BayesianUpdater.detectDrift(model, alternating(2.0));
        DriftReport critical = BayesianUpdater.detectDrift(model, alternating(3.0));

        assertThat(mild.hasDrift()).isTrue();
        assertThat(mild.getSeverity()).isCloseTo(2.25, within(1e-12));
        assertThat(mild.getRecommendation()).isEqualTo("Mild drift - continue monitoring");
        assertThat(significant.getRecommendation())
                .isEqualTo("Significant drift - increase learning rate or add more recent observations");
        assertThat(critical.getSeverity()).isCloseTo(9.0, within(1e-12));
        assertThat(critical.getRecommendation())
                .isEqualTo("Critical drift detected - recommend full model reset with recent data");
    }

    @Test
    @DisplayName("A custom threshold should change the drift verdict")
    void shouldHonourCustomThreshold() {
        DriftReport report = BayesianUpdater.detectDrift(BayesianUpdater.initialize(1), alternating(1.5), 3.0);

        assertThat(report.hasDrift()).isFalse();
        assertThat(report.getSeverity()).isCloseTo(2.25, within(1e-12));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Noise-free {@code y = 2·x1 + 3·x2} with varied features. */
    private static List<DataPoint> linearPoints(int count) {
        List<DataPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double x1 = 1 + (i % 5);
            double x2 = 2 + ((i * 3) % 7);
            points.add(new DataPoint(new double[]{x1, x2}, 2 * x1 + 3 * x2));
        }
        return points;
    }

    /** Six residuals of alternating sign, population variance {@code magnitude²}. */
    private static List<Double> alternating(double magnitude) {
        List<Double> residuals = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            residuals.add(i % 2 == 0 ? magnitude : -magnitude);
        }
        return residuals;
    }
}
