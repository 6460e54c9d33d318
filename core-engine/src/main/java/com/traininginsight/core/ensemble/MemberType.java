package com.traininginsight.core.ensemble;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Model family of an ensemble member.
 *
 * @since 1.0.0
 */
public enum MemberType {

    REGRESSION("regression"),
    TIME_SERIES("time_series"),
    BAYESIAN("bayesian"),
    CUSTOM("custom");

    private final String key;

    MemberType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
