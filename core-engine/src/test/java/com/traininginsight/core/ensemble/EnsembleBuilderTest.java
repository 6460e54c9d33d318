package com.traininginsight.core.ensemble;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EnsembleBuilder} and {@link EnsembleMember}.
 */
class EnsembleBuilderTest {

    @Test
    @DisplayName("Should keep members in insertion order")
    void shouldPreserveInsertionOrder() {
        List<EnsembleMember> members = new EnsembleBuilder()
                .add(member("first", 0.1))
                .add(member("second", 0.9))
                .build();

        assertThat(members).extracting(EnsembleMember::getId).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should omit optional members at or below the confidence threshold")
    void shouldGateOnConfidence() {
        EnsembleBuilder builder = new EnsembleBuilder()
                .addIfConfident(member("weak", 0.3), 0.3)
                .addIfConfident(member("strong", 0.31), 0.3);

        assertThat(builder.size()).isEqualTo(1);
        assertThat(builder.build()).extracting(EnsembleMember::getId).containsExactly("strong");
    }

    @Test
    @DisplayName("Confidence gate should fall back to R² when no confidence is reported")
    void shouldFallBackToR2() {
        EnsembleMember noConfidence = EnsembleMember.builder()
                .id("r2-only")
                .type(MemberType.REGRESSION)
                .performance(new ModelPerformance(1, 1, 0.8, 0.8))
                .prediction(5)
                .build();

        assertThat(new EnsembleBuilder().addIfConfident(noConfidence, 0.5).size()).isEqualTo(1);
        assertThat(new EnsembleBuilder().addIfConfident(noConfidence, 0.9).size()).isZero();
    }

    @Test
    @DisplayName("Built list should be unmodifiable")
    void builtListShouldBeUnmodifiable() {
        List<EnsembleMember> members = new EnsembleBuilder().add(member("only", 0.5)).build();

        assertThatThrownBy(() -> members.add(member("extra", 0.5)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("A member without predictions should be rejected")
    void memberShouldRequireAPrediction() {
        assertThatThrownBy(() -> EnsembleMember.builder()
                .id("empty")
                .type(MemberType.CUSTOM)
                .performance(new ModelPerformance(0, 0, 0, 0))
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("withWeight should copy every field except the weight")
    void withWeightShouldCopyMember() {
        EnsembleMember original = member("copy", 0.7);

        EnsembleMember reweighted = original.withWeight(2.5);

        assertThat(reweighted.getWeight()).isEqualTo(2.5);
        assertThat(original.getWeight()).isEqualTo(1.0);
        assertThat(reweighted.getId()).isEqualTo("copy");
        assertThat(reweighted.getName()).isEqualTo("copy");
        assertThat(reweighted.getPredictions()).containsExactly(12.0, 13.0);
        assertThat(reweighted.getConfidence()).isEqualTo(0.7);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EnsembleMember member(String id, double confidence) {
        return EnsembleMember.builder()
                .id(id)
                .type(MemberType.TIME_SERIES)
                .performance(new ModelPerformance(1, 1, 0, 0))
                .predictions(List.of(12.0, 13.0))
                .confidence(confidence)
                .build();
    }
}
