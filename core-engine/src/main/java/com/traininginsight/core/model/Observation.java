package com.traininginsight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One recorded training session.
 *
 * <p>
 * Supplied by the caller and never mutated by the engine. Distance is in
 * kilometres, duration in minutes and elevation gain in metres. The
 * physiological readings are optional and may be {@code null}; consumers
 * substitute their own defaults.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code timestamp} is <strong>required</strong>.
 * Jackson binds through the annotated constructor.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Observation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double distance;
    private final double duration;
    private final double elevation;
    private final Double avgHeartRate;
    private final Double perceivedEffort;
    private final Double fatigue;
    private final Double sleepQuality;
    private final Double readiness;

    @JsonCreator
    public Observation(@JsonProperty("timestamp") Instant timestamp,
                       @JsonProperty("distance") double distance,
                       @JsonProperty("duration") double duration,
                       @JsonProperty("elevation") double elevation,
                       @JsonProperty("avgHR") Double avgHeartRate,
                       @JsonProperty("perceivedEffort") Double perceivedEffort,
                       @JsonProperty("fatigue") Double fatigue,
                       @JsonProperty("sleepQuality") Double sleepQuality,
                       @JsonProperty("readiness") Double readiness) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.distance = distance;
        this.duration = duration;
        this.elevation = elevation;
        this.avgHeartRate = avgHeartRate;
        this.perceivedEffort = perceivedEffort;
        this.fatigue = fatigue;
        this.sleepQuality = sleepQuality;
        this.readiness = readiness;
    }

    private Observation(Builder b) {
        this(b.timestamp, b.distance, b.duration, b.elevation, b.avgHeartRate,
                b.perceivedEffort, b.fatigue, b.sleepQuality, b.readiness);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Observation}.
     */
    public static class Builder {
        private Instant timestamp;
        private double distance;
        private double duration;
        private double elevation;
        private Double avgHeartRate;
        private Double perceivedEffort;
        private Double fatigue;
        private Double sleepQuality;
        private Double readiness;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder distance(double distance) {
            this.distance = distance;
            return this;
        }

        public Builder duration(double duration) {
            this.duration = duration;
            return this;
        }

        public Builder elevation(double elevation) {
            this.elevation = elevation;
            return this;
        }

        public Builder avgHeartRate(Double avgHeartRate) {
            this.avgHeartRate = avgHeartRate;
            return this;
        }

        public Builder perceivedEffort(Double perceivedEffort) {
            this.perceivedEffort = perceivedEffort;
            return this;
        }

        public Builder fatigue(Double fatigue) {
            this.fatigue = fatigue;
            return this;
        }

        public Builder sleepQuality(Double sleepQuality) {
            this.sleepQuality = sleepQuality;
            return this;
        }

        public Builder readiness(Double readiness) {
            this.readiness = readiness;
            return this;
        }

        /**
         * @return a new {@link Observation}
         * @throws NullPointerException if {@code timestamp} is {@code null}
         */
        public Observation build() {
            return new Observation(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getDistance() {
        return distance;
    }

    public double getDuration() {
        return duration;
    }

    public double getElevation() {
        return elevation;
    }

    /** @return average heart rate in bpm, or {@code null} if not recorded */
    public Double getAvgHeartRate() {
        return avgHeartRate;
    }

    /** @return perceived effort on a 1-10 scale, or {@code null} */
    public Double getPerceivedEffort() {
        return perceivedEffort;
    }

    /** @return fatigue on a 1-10 scale, or {@code null} */
    public Double getFatigue() {
        return fatigue;
    }

    /** @return sleep quality on a 1-10 scale, or {@code null} */
    public Double getSleepQuality() {
        return sleepQuality;
    }

    /** @return readiness score 0-100, or {@code null} */
    public Double getReadiness() {
        return readiness;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return Double.compare(distance, that.distance) == 0
                && Double.compare(duration, that.duration) == 0
                && Double.compare(elevation, that.elevation) == 0
                && timestamp.equals(that.timestamp)
                && Objects.equals(avgHeartRate, that.avgHeartRate)
                && Objects.equals(perceivedEffort, that.perceivedEffort)
                && Objects.equals(fatigue, that.fatigue)
                && Objects.equals(sleepQuality, that.sleepQuality)
                && Objects.equals(readiness, that.readiness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, distance, duration, elevation);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "timestamp=" + timestamp +
                ", distance=" + distance +
                ", duration=" + duration +
                ", elevation=" + elevation +
                '}';
    }
}
