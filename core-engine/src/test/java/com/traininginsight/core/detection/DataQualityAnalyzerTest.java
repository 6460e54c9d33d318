package com.traininginsight.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DataQualityAnalyzer}.
 */
class DataQualityAnalyzerTest {

    private static final double[] SESSIONS = {40, 42, 38, 45, 150, 41, 43};

    @Test
    @DisplayName("Should report the outlier by input index and keep the rest in order")
    void shouldSeparateOutliersFromCleanValues() {
        DataQualityReport report = DataQualityAnalyzer.generateReport(SESSIONS);

        assertThat(report.getTotalPoints()).isEqualTo(7);
        assertThat(report.getOutlierIndices()).containsExactly(4);
        assertThat(report.isOutlier(4)).isTrue();
        assertThat(report.getCleanValues()).containsExactly(40.0, 42.0, 38.0, 45.0, 41.0, 43.0);
        assertThat(report.getOutlierPercentage()).isCloseTo(100.0 / 7, within(1e-9));
    }

    @Test
    @DisplayName("Should compute summary statistics over the original series")
    void shouldComputeStatisticsOverOriginalSeries() {
        SeriesStatistics stats = DataQualityAnalyzer.generateReport(SESSIONS).getStatistics();

        assertThat(stats.getMean()).isCloseTo(57.0, within(1e-9));
        assertThat(stats.getMedian()).isEqualTo(42.0);
        assertThat(stats.getMad()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should honour the requested method")
    void shouldUseRequestedMethod() {
        DataQualityReport report = DataQualityAnalyzer.generateReport(SESSIONS, OutlierMethod.IQR);

        assertThat(report.getOutlierIndices()).containsExactly(4);
    }

    @Test
    @DisplayName("Should return an empty report for an empty series")
    void shouldHandleEmptySeries() {
        DataQualityReport report = DataQualityAnalyzer.generateReport(new double[0]);

        assertThat(report.getTotalPoints()).isZero();
        assertThat(report.getOutlierIndices()).isEmpty();
        assertThat(report.getCleanValues()).isEmpty();
    }

    @Test
    @DisplayName("Should reject the multivariate method")
    void shouldRejectMahalanobis() {
        assertThatThrownBy(() -> DataQualityAnalyzer.generateReport(SESSIONS, OutlierMethod.MAHALANOBIS))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
