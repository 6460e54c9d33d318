package com.traininginsight.core.detection;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of cleaning one series.
 *
 * <p>
 * {@link #getOutlierIndices()} refers to positions in the <em>input</em>
 * series and is never renumbered; {@link #getCleanValues()} keeps the
 * surviving values in their original order.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataQualityReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalPoints;
    private final List<Integer> outlierIndices;
    private final double outlierPercentage;
    private final List<Double> cleanValues;
    private final SeriesStatistics statistics;

    public DataQualityReport(int totalPoints, List<Integer> outlierIndices, double outlierPercentage,
                             List<Double> cleanValues, SeriesStatistics statistics) {
        this.totalPoints = totalPoints;
        this.outlierIndices = List.copyOf(Objects.requireNonNull(outlierIndices, "outlierIndices must not be null"));
        this.outlierPercentage = outlierPercentage;
        this.cleanValues = List.copyOf(Objects.requireNonNull(cleanValues, "cleanValues must not be null"));
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
    }

    /**
     * @return a report for an empty series
     */
    public static DataQualityReport empty() {
        return new DataQualityReport(0, Collections.emptyList(), 0, Collections.emptyList(), SeriesStatistics.EMPTY);
    }

    public int getTotalPoints() {
        return totalPoints;
    }

    /** @return unmodifiable, ascending input indices of flagged points */
    public List<Integer> getOutlierIndices() {
        return outlierIndices;
    }

    /** @return share of flagged points in percent (0-100) */
    public double getOutlierPercentage() {
        return outlierPercentage;
    }

    /** @return unmodifiable list of retained values */
    public List<Double> getCleanValues() {
        return cleanValues;
    }

    public SeriesStatistics getStatistics() {
        return statistics;
    }

    public boolean isOutlier(int index) {
        return Collections.binarySearch(outlierIndices, index) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataQualityReport that))
            return false;
        return totalPoints == that.totalPoints
                && outlierIndices.equals(that.outlierIndices)
                && cleanValues.equals(that.cleanValues)
                && statistics.equals(that.statistics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalPoints, outlierIndices, cleanValues, statistics);
    }

    @Override
    public String toString() {
        return "DataQualityReport{" +
                "totalPoints=" + totalPoints +
                ", outlierIndices=" + outlierIndices +
                ", outlierPercentage=" + outlierPercentage +
                ", statistics=" + statistics +
                '}';
    }
}
