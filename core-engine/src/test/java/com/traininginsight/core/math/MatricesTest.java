package com.traininginsight.core.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Matrices}.
 */
class MatricesTest {

    @Test
    @DisplayName("Should invert a well-conditioned matrix")
    void shouldInvert() {
        double[][] inverse = Matrices.invertOrIdentity(new double[][]{{2, 0}, {0, 4}});

        assertThat(inverse[0][0]).isCloseTo(0.5, within(1e-12));
        assertThat(inverse[1][1]).isCloseTo(0.25, within(1e-12));
        assertThat(inverse[0][1]).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Should substitute the identity for a singular matrix")
    void shouldFallBackToIdentity() {
        double[][] inverse = Matrices.invertOrIdentity(new double[][]{{1, 2}, {2, 4}});

        assertThat(inverse).isDeepEqualTo(new double[][]{{1, 0}, {0, 1}});
    }

    @Test
    @DisplayName("Should solve a regular linear system")
    void shouldSolveRegularSystem() {
        double[] x = Matrices.solve(new double[][]{{2, 1}, {1, 3}}, new double[]{3, 5});

        assertThat(x[0]).isCloseTo(0.8, within(1e-12));
        assertThat(x[1]).isCloseTo(1.4, within(1e-12));
    }

    @Test
    @DisplayName("Should return the minimum-norm solution of a singular system")
    void shouldSolveSingularSystemByLeastSquares() {
        double[] x = Matrices.solve(new double[][]{{1, 1}, {1, 1}}, new double[]{2, 2});

        assertThat(x[0]).isCloseTo(1.0, within(1e-9));
        assertThat(x[1]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should reject non-square matrices")
    void shouldRejectNonSquare() {
        assertThatThrownBy(() -> Matrices.invertOrIdentity(new double[][]{{1, 2, 3}, {4, 5, 6}}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("square");
    }

    @Test
    @DisplayName("Should evaluate a quadratic form")
    void shouldEvaluateQuadraticForm() {
        double value = Matrices.quadraticForm(new double[]{1, 2}, new double[][]{{2, 1}, {1, 3}});

        // 2 + 2·1·2·1 + 3·4
        assertThat(value).isEqualTo(18.0);
    }
}
