package com.traininginsight.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MahalanobisOutlierDetector}.
 */
class MahalanobisOutlierDetectorTest {

    @Test
    @DisplayName("Should flag a point that breaks the correlation of the cloud")
    void shouldFlagPointOffTheCorrelation() {
        List<double[]> points = new ArrayList<>();
        for (int i = 1; i < 20; i++) {
            points.add(new double[]{i, 2 * i + (i % 2 == 0 ? 0.3 : -0.3)});
        }
        // close to both marginal means, far from the y = 2x line
        points.add(new double[]{10, 2});

        List<OutlierResult> results = new MahalanobisOutlierDetector().detect(points);

        assertThat(results.get(19).isOutlier()).isTrue();
        assertThat(results.get(19).getMethod()).isEqualTo("mahalanobis");
        assertThat(results.subList(0, 19)).noneMatch(OutlierResult::isOutlier);
    }

    @Test
    @DisplayName("Should fall back to Euclidean distance when the covariance is singular")
    void shouldUseIdentityForSingularCovariance() {
        List<double[]> points = List.of(
                new double[]{0, 5},
                new double[]{0, 5},
                new double[]{0, 5},
                new double[]{10, 5});

        List<OutlierResult> results = new MahalanobisOutlierDetector().detect(points);

        // mean x = 2.5, second feature constant
        assertThat(results.get(3).getScore()).isCloseTo(7.5, within(1e-9));
        assertThat(results.get(3).isOutlier()).isTrue();
        assertThat(results.get(0).getScore()).isCloseTo(2.5, within(1e-9));
        assertThat(results.get(0).isOutlier()).isFalse();
    }

    @Test
    @DisplayName("Should reject feature vectors of different lengths")
    void shouldRejectRaggedInput() {
        List<double[]> points = List.of(new double[]{1, 2}, new double[]{1, 2, 3});

        assertThatThrownBy(() -> new MahalanobisOutlierDetector().detect(points))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("length");
    }
}
