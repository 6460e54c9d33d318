package com.traininginsight.core.detection;

import java.io.Serializable;
import java.util.Objects;

/**
 * Summary statistics of the original (uncleaned) series.
 *
 * @since 1.0.0
 */
public final class SeriesStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    static final SeriesStatistics EMPTY = new SeriesStatistics(0, 0, 0, 0, 0);

    private final double mean;
    private final double median;
    private final double stdDev;
    private final double iqr;
    private final double mad;

    public SeriesStatistics(double mean, double median, double stdDev, double iqr, double mad) {
        this.mean = mean;
        this.median = median;
        this.stdDev = stdDev;
        this.iqr = iqr;
        this.mad = mad;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getIqr() {
        return iqr;
    }

    public double getMad() {
        return mad;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesStatistics that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(iqr, that.iqr) == 0
                && Double.compare(mad, that.mad) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, median, stdDev, iqr, mad);
    }

    @Override
    public String toString() {
        return "SeriesStatistics{" +
                "mean=" + mean +
                ", median=" + median +
                ", stdDev=" + stdDev +
                ", iqr=" + iqr +
                ", mad=" + mad +
                '}';
    }
}
