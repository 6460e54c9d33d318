package com.traininginsight.core.regression;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Least-squares fitting strategies.
 *
 * @since 1.0.0
 */
public enum RegressionType {

    LINEAR("linear"),
    RIDGE("ridge"),
    TIME_WEIGHTED("time_weighted"),
    POLYNOMIAL("polynomial");

    private final String key;

    RegressionType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static RegressionType fromKey(String key) {
        Objects.requireNonNull(key, "Regression type must not be null");
        String normalised = key.toLowerCase(Locale.ROOT);
        for (RegressionType t : values()) {
            if (t.key.equals(normalised)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown regression type: '" + key
                + "'. Supported: linear, ridge, time_weighted, polynomial");
    }
}
