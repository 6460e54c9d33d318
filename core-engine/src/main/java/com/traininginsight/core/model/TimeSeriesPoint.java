package com.traininginsight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single timestamped scalar, the input unit of trend analysis and
 * forecasting.
 *
 * @since 1.0.0
 */
public final class TimeSeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    public TimeSeriesPoint(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "TimeSeriesPoint{" + timestamp + " -> " + value + '}';
    }
}
