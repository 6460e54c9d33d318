package com.traininginsight.core.ensemble;

import java.util.Locale;
import java.util.Objects;

/**
 * How member predictions are merged.
 *
 * @since 1.0.0
 */
public enum EnsembleStrategy {

    /** Normalized static weights. */
    WEIGHTED_AVERAGE("weighted_average"),

    /** Median of first predictions, MAD-based spread. */
    MEDIAN("median"),

    /** Weights recomputed from recent absolute errors. */
    ADAPTIVE("adaptive");

    private final String key;

    EnsembleStrategy(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static EnsembleStrategy fromKey(String key) {
        Objects.requireNonNull(key, "Ensemble strategy must not be null");
        String normalised = key.toLowerCase(Locale.ROOT);
        for (EnsembleStrategy s : values()) {
            if (s.key.equals(normalised)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown ensemble method: '" + key
                + "'. Supported: weighted_average, median, adaptive");
    }
}
