package com.traininginsight.core.trend;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a monotonic trend.
 */
public enum TrendDirection {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String key;

    TrendDirection(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
