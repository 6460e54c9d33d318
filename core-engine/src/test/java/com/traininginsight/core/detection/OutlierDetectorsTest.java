package com.traininginsight.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the univariate detectors built by {@link OutlierDetectors}.
 */
class OutlierDetectorsTest {

    @Test
    @DisplayName("Should create the detector matching each univariate method")
    void shouldCreateDetectorPerMethod() {
        assertThat(OutlierDetectors.create(OutlierMethod.Z_SCORE)).isInstanceOf(ZScoreOutlierDetector.class);
        assertThat(OutlierDetectors.create(OutlierMethod.MODIFIED_Z_SCORE))
                .isInstanceOf(ModifiedZScoreOutlierDetector.class);
        assertThat(OutlierDetectors.create(OutlierMethod.IQR)).isInstanceOf(IqrOutlierDetector.class);
        assertThat(OutlierDetectors.create(OutlierMethod.TIME_SERIES_WINDOW))
                .isInstanceOf(TimeSeriesWindowOutlierDetector.class);
    }

    @Test
    @DisplayName("Should refuse to build a univariate detector for Mahalanobis")
    void shouldRejectMahalanobis() {
        assertThatThrownBy(() -> OutlierDetectors.create(OutlierMethod.MAHALANOBIS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("feature vectors");
    }

    @Test
    @DisplayName("Should resolve method keys case-insensitively")
    void shouldResolveKeys() {
        assertThat(OutlierMethod.fromKey("Modified_Z_Score")).isEqualTo(OutlierMethod.MODIFIED_Z_SCORE);
        assertThatThrownBy(() -> OutlierMethod.fromKey("grubbs"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown outlier method");
    }

    // ---------------------------------------------------------------
    // Modified Z-score
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Modified Z-score should flag the single extreme session")
    void modifiedZScoreShouldFlagExtremeValue() {
        List<OutlierResult> results = OutlierDetectors.create(OutlierMethod.MODIFIED_Z_SCORE)
                .detect(new double[]{40, 42, 38, 45, 150, 41, 43});

        assertThat(flagged(results)).containsExactly(4);
        assertThat(results.get(4).getMethod()).isEqualTo("modified_z_score");
        assertThat(results.get(4).getReason()).hasValueSatisfying(r -> assertThat(r).contains("Modified Z-score"));
        assertThat(results.get(0).getReason()).isEmpty();
    }

    @Test
    @DisplayName("Modified Z-score should score 0 everywhere when MAD is 0")
    void modifiedZScoreShouldNotFireOnZeroMad() {
        List<OutlierResult> results = new ModifiedZScoreOutlierDetector().detect(new double[]{5, 5, 5, 5, 9});

        assertThat(results).allSatisfy(r -> {
            assertThat(r.isOutlier()).isFalse();
            assertThat(r.getScore()).isZero();
        });
    }

    // ---------------------------------------------------------------
    // Z-score
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Z-score should flag a value more than 3σ from the mean")
    void zScoreShouldFlagDistantValue() {
        double[] values = {10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 50};

        List<OutlierResult> results = new ZScoreOutlierDetector().detect(values);

        assertThat(flagged(results)).containsExactly(10);
        assertThat(results.get(10).getScore()).isGreaterThan(3.0);
    }

    @Test
    @DisplayName("Z-score should not fire on constant data")
    void zScoreShouldNotFireOnConstantData() {
        List<OutlierResult> results = new ZScoreOutlierDetector().detect(new double[]{7, 7, 7, 7});

        assertThat(flagged(results)).isEmpty();
    }

    // ---------------------------------------------------------------
    // IQR
    // ---------------------------------------------------------------

    @Test
    @DisplayName("IQR should flag values outside the Tukey fences with normalized distance")
    void iqrShouldFlagOutsideFences() {
        // Q1 = 3, Q3 = 7, IQR = 4, upper fence = 13
        List<OutlierResult> results = new IqrOutlierDetector().detect(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 100});

        assertThat(flagged(results)).containsExactly(8);
        assertThat(results.get(8).getScore()).isEqualTo(87.0 / 4);
        assertThat(results.get(0).getScore()).isZero();
    }

    // ---------------------------------------------------------------
    // Time-series window
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Windowed detector should flag a local spike")
    void timeSeriesWindowShouldFlagLocalSpike() {
        double[] values = {10, 10, 11, 10, 10, 30, 10, 11, 10, 10};

        List<OutlierResult> results = new TimeSeriesWindowOutlierDetector().detect(values);

        assertThat(results).hasSize(values.length);
        assertThat(flagged(results)).containsExactly(5);
    }

    @Test
    @DisplayName("Windowed detector should treat a single point as an inlier")
    void timeSeriesWindowShouldHandleSinglePoint() {
        List<OutlierResult> results = new TimeSeriesWindowOutlierDetector().detect(new double[]{42});

        assertThat(results).singleElement().satisfies(r -> assertThat(r.isOutlier()).isFalse());
    }

    @Test
    @DisplayName("Every detector should return an empty list for empty input")
    void shouldHandleEmptyInput() {
        for (OutlierMethod method : List.of(OutlierMethod.Z_SCORE, OutlierMethod.MODIFIED_Z_SCORE,
                OutlierMethod.IQR, OutlierMethod.TIME_SERIES_WINDOW)) {
            assertThat(OutlierDetectors.create(method).detect(new double[0])).isEmpty();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<Integer> flagged(List<OutlierResult> results) {
        return IntStream.range(0, results.size())
                .filter(i -> results.get(i).isOutlier())
                .boxed()
                .toList();
    }
}
