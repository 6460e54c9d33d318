package com.traininginsight.core.regression;

import com.traininginsight.core.model.DataPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RegressionFitter}.
 */
class RegressionFitterTest {

    private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");

    private RegressionFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new RegressionFitter(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("OLS should recover an exact linear relationship")
    void linearShouldRecoverExactModel() {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            double x1 = i;
            double x2 = (i * i) % 7;
            points.add(new DataPoint(new double[]{x1, x2}, 3 + 2 * x1 - x2));
        }

        RegressionModel model = fitter.fitLinear(points);

        assertThat(model.getIntercept()).isCloseTo(3.0, within(1e-8));
        assertThat(model.getCoefficients()[0]).isCloseTo(2.0, within(1e-8));
        assertThat(model.getCoefficients()[1]).isCloseTo(-1.0, within(1e-8));
        assertThat(model.getR2Score()).isCloseTo(1.0, within(1e-9));
        assertThat(model.getMse()).isCloseTo(0.0, within(1e-12));
        assertThat(model.getSampleCount()).isEqualTo(20);
        assertThat(model.getModelType()).isEqualTo(RegressionType.LINEAR);
        assertThat(model.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Ridge with λ = 0 should reproduce OLS")
    void ridgeWithZeroLambdaShouldMatchOls() {
        List<DataPoint> points = noisyPlane();

        RegressionModel ols = fitter.fitLinear(points);
        RegressionModel ridge = fitter.fitRidge(points, 0);

        assertThat(ridge.getIntercept()).isCloseTo(ols.getIntercept(), within(1e-9));
        for (int i = 0; i < ols.getCoefficientCount(); i++) {
            assertThat(ridge.getCoefficients()[i]).isCloseTo(ols.getCoefficients()[i], within(1e-9));
        }
    }

    @Test
    @DisplayName("Increasing λ should shrink the coefficient norm monotonically")
    void ridgeShouldShrinkMonotonically() {
        List<DataPoint> points = noisyPlane();

        double previous = Double.POSITIVE_INFINITY;
        for (double lambda : new double[]{0, 1, 10, 100, 1000, 10000}) {
            double norm = norm(fitter.fitRidge(points, lambda).getCoefficients());
            assertThat(norm).as("norm at λ=%s", lambda).isLessThan(previous);
            previous = norm;
        }
    }

    @Test
    @DisplayName("Time-weighted fit should follow the recent regime")
    void timeWeightedShouldFavourRecentPoints() {
        List<DataPoint> points = new ArrayList<>();
        for (int x = 1; x <= 5; x++) {
            points.add(point(x, x + 20, NOW.minus(Duration.ofDays(300))));
            points.add(point(x, x, NOW.minus(Duration.ofDays(5 - x))));
        }

        RegressionModel weighted = fitter.fitTimeWeighted(points, 30);
        RegressionModel plain = fitter.fitLinear(points);

        assertThat(weighted.getIntercept()).isLessThan(0.5);
        assertThat(plain.getIntercept()).isCloseTo(10.0, within(1e-8));
        // metrics are measured against all targets, unweighted
        assertThat(weighted.getMse()).isGreaterThan(100.0);
        assertThat(weighted.getModelType()).isEqualTo(RegressionType.TIME_WEIGHTED);
    }

    @Test
    @DisplayName("Time-weighted fit should weight undated points equally")
    void timeWeightedWithoutTimestampsShouldMatchOls() {
        List<DataPoint> points = noisyPlane();

        RegressionModel weighted = fitter.fitTimeWeighted(points, 30);
        RegressionModel ols = fitter.fitLinear(points);

        assertThat(weighted.getCoefficients()[0]).isCloseTo(ols.getCoefficients()[0], within(1e-9));
        assertThat(weighted.getIntercept()).isCloseTo(ols.getIntercept(), within(1e-9));
    }

    @Test
    @DisplayName("Polynomial fit should capture a quadratic and predict from raw features")
    void polynomialShouldFitQuadratic() {
        List<DataPoint> points = new ArrayList<>();
        for (int x = 1; x <= 10; x++) {
            points.add(new DataPoint(new double[]{x}, x * x));
        }

        RegressionModel model = fitter.fitPolynomial(points, 2);

        assertThat(model.getCoefficientCount()).isEqualTo(2);
        assertThat(model.getPolynomialDegree()).isEqualTo(2);
        assertThat(model.getR2Score()).isGreaterThan(0.999);
        assertThat(model.predict(new double[]{11})).isCloseTo(121.0, within(0.5));
    }

    @Test
    @DisplayName("Should stay finite when there are more features than points")
    void shouldHandleUnderdeterminedSystem() {
        List<DataPoint> points = List.of(
                new DataPoint(new double[]{1, 2, 3}, 4),
                new DataPoint(new double[]{2, 3, 5}, 7));

        RegressionModel model = fitter.fitLinear(points);

        assertThat(model.getCoefficients()).allSatisfy(c -> assertThat(c).isFinite());
        assertThat(model.getR2Score()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("fit() should dispatch on the regression type")
    void fitShouldDispatch() {
        List<DataPoint> points = noisyPlane();

        assertThat(fitter.fit(points, RegressionType.RIDGE).getModelType()).isEqualTo(RegressionType.RIDGE);
        assertThat(fitter.fit(points, RegressionType.LINEAR).getIntercept())
                .isEqualTo(fitter.fitLinear(points).getIntercept());
    }

    @Test
    @DisplayName("Should reject an empty training set")
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> fitter.fitLinear(Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zero points");
    }

    @Test
    @DisplayName("Should reject a prediction vector of the wrong width")
    void shouldRejectWrongWidthOnPredict() {
        RegressionModel model = fitter.fitLinear(noisyPlane());

        assertThatThrownBy(() -> model.predict(new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** y = 1 + 0.5·x1 + 2·x2 + deterministic noise, 30 points. */
    private static List<DataPoint> noisyPlane() {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            double x1 = i;
            double x2 = Math.cos(i * 0.7) * 5;
            points.add(new DataPoint(new double[]{x1, x2}, 1 + 0.5 * x1 + 2 * x2 + Math.sin(i)));
        }
        return points;
    }

    private static DataPoint point(double x, double y, Instant timestamp) {
        return new DataPoint(new double[]{x}, y, 1.0, timestamp);
    }

    private static double norm(double[] v) {
        double sum = 0;
        for (double c : v) {
            sum += c * c;
        }
        return Math.sqrt(sum);
    }
}
