package com.traininginsight.core.feature;

import com.traininginsight.core.model.DataPoint;
import com.traininginsight.core.model.Observation;
import com.traininginsight.core.model.TargetVariable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureEngineer}.
 */
class FeatureEngineerTest {

    private static final Instant NOW = Instant.parse("2026-03-31T08:00:00Z");

    private FeatureEngineer engineer;
    private List<Observation> sessions;

    @BeforeEach
    void setUp() {
        engineer = new FeatureEngineer();
        sessions = List.of(
                // Sunday, no optional readings
                session("2026-03-01T08:00:00Z", 10, 60).elevation(100).build(),
                // Monday
                session("2026-03-02T08:00:00Z", 20, 120)
                        .avgHeartRate(140.0).perceivedEffort(7.0).sleepQuality(8.0).readiness(60.0).fatigue(6.0)
                        .build(),
                // Saturday, zero duration
                session("2026-03-07T08:00:00Z", 30, 0).build());
    }

    @Test
    @DisplayName("Should produce one fixed-width point per observation, in order")
    void shouldPreserveOrderAndWidth() {
        List<DataPoint> points = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW);

        assertThat(points).hasSize(3);
        assertThat(points).allSatisfy(p -> assertThat(p.dimension()).isEqualTo(FeatureEngineer.FEATURE_COUNT));
        assertThat(points).extracting(DataPoint::getTarget).containsExactly(10.0, 20.0, 30.0);
        assertThat(FeatureEngineer.FEATURE_NAMES).hasSize(FeatureEngineer.FEATURE_COUNT);
    }

    @Test
    @DisplayName("Should substitute defaults for missing physiological readings")
    void shouldApplyDefaults() {
        double[] first = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW).get(0).getFeatures();

        assertThat(first).startsWith(10, 60, 100, 10, 150, 5, 7, 75);
    }

    @Test
    @DisplayName("Should use reported readings when present")
    void shouldUseReportedReadings() {
        double[] second = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW).get(1).getFeatures();

        assertThat(second[4]).isEqualTo(140.0);
        assertThat(second[5]).isEqualTo(7.0);
        assertThat(second[6]).isEqualTo(8.0);
        assertThat(second[7]).isEqualTo(60.0);
    }

    @Test
    @DisplayName("Should report zero pace for zero duration")
    void shouldGuardPace() {
        double[] third = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW).get(2).getFeatures();

        assertThat(third[3]).isZero();
    }

    @Test
    @DisplayName("Should encode the day of week on the unit circle with Sunday = 0")
    void shouldEncodeDayOfWeek() {
        List<DataPoint> points = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW);

        assertThat(points.get(0).feature(8)).isCloseTo(0.0, within(1e-12));
        assertThat(points.get(0).feature(9)).isCloseTo(1.0, within(1e-12));
        assertThat(points.get(1).feature(8)).isCloseTo(Math.sin(2 * Math.PI / 7), within(1e-12));
        assertThat(points.get(2).feature(9)).isCloseTo(Math.cos(2 * Math.PI * 6 / 7), within(1e-12));
    }

    @Test
    @DisplayName("Should derive the day of week in the configured zone")
    void shouldHonourZone() {
        // Sunday 23:30 UTC is Monday in Auckland
        Observation lateSunday = session("2026-03-01T23:30:00Z", 5, 30).build();
        FeatureEngineer auckland = new FeatureEngineer(ZoneId.of("Pacific/Auckland"), 30);

        DataPoint point = auckland.engineer(List.of(lateSunday), TargetVariable.DISTANCE, NOW).get(0);

        assertThat(point.feature(8)).isCloseTo(Math.sin(2 * Math.PI / 7), within(1e-12));
    }

    @Test
    @DisplayName("Should average distance over the last three sessions once available")
    void shouldComputeRollingDistance() {
        List<DataPoint> points = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW);

        assertThat(points.get(0).feature(10)).isEqualTo(10.0);
        assertThat(points.get(1).feature(10)).isEqualTo(20.0);
        assertThat(points.get(2).feature(10)).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Should decay weight exponentially with age")
    void shouldWeightByRecency() {
        List<DataPoint> points = engineer.engineer(sessions, TargetVariable.DISTANCE, NOW);

        assertThat(points.get(0).getWeight()).isCloseTo(Math.exp(-1), within(1e-12));
        assertThat(points.get(2).getWeight()).isGreaterThan(points.get(1).getWeight());
    }

    @Test
    @DisplayName("Should place the requested target variable in each point")
    void shouldUseRequestedTarget() {
        List<DataPoint> points = engineer.engineer(sessions, TargetVariable.FATIGUE, NOW);

        assertThat(points).extracting(DataPoint::getTarget).containsExactly(5.0, 6.0, 5.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Observation.Builder session(String timestamp, double distance, double duration) {
        return Observation.builder()
                .timestamp(Instant.parse(timestamp))
                .distance(distance)
                .duration(duration);
    }
}
