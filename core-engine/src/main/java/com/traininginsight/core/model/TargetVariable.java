package com.traininginsight.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The observation field the learning loop predicts.
 *
 * @since 1.0.0
 */
public enum TargetVariable {

    DISTANCE("distance", "km"),
    FATIGUE("fatigue", "points"),
    READINESS("readiness", "points");

    private static final double DEFAULT_FATIGUE = 5;
    private static final double DEFAULT_READINESS = 75;

    private final String key;
    private final String unit;

    TargetVariable(String key, String unit) {
        this.key = key;
        this.unit = unit;
    }

    /**
     * Extract this variable from an observation, substituting the population
     * default when the reading is missing.
     *
     * @param observation the session; must not be {@code null}
     * @return target value
     */
    public double valueOf(Observation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");
        return switch (this) {
            case DISTANCE -> observation.getDistance();
            case FATIGUE -> observation.getFatigue() != null ? observation.getFatigue() : DEFAULT_FATIGUE;
            case READINESS -> observation.getReadiness() != null ? observation.getReadiness() : DEFAULT_READINESS;
        };
    }

    public String getKey() {
        return key;
    }

    /** @return unit used when describing weekly change of this variable */
    public String getUnit() {
        return unit;
    }

    /**
     * Resolve a variable from its key, case-insensitively.
     *
     * @param key e.g. {@code "distance"}
     * @return matching variable
     * @throws IllegalArgumentException if no variable matches
     */
    public static TargetVariable fromKey(String key) {
        Objects.requireNonNull(key, "Target variable key must not be null");
        String normalised = key.toLowerCase(Locale.ROOT);
        for (TargetVariable v : values()) {
            if (v.key.equals(normalised)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown target variable: '" + key
                + "'. Supported: distance, fatigue, readiness");
    }
}
