package com.traininginsight.core.detection;

import com.traininginsight.core.math.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a univariate detector over a series and summarises the result.
 *
 * @since 1.0.0
 */
public final class DataQualityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(DataQualityAnalyzer.class);

    private DataQualityAnalyzer() {
        // utility class
    }

    /**
     * Generate a report with the robust default, the modified Z-score.
     */
    public static DataQualityReport generateReport(double[] values) {
        return generateReport(values, OutlierMethod.MODIFIED_Z_SCORE);
    }

    /**
     * Flag outliers with the given method and compute summary statistics
     * over the original series.
     *
     * @param values the series; must not be {@code null}
     * @param method a univariate method
     * @return the report
     * @throws IllegalArgumentException if {@code method} is not univariate
     */
    public static DataQualityReport generateReport(double[] values, OutlierMethod method) {
        Objects.requireNonNull(values, "values must not be null");
        OutlierDetector detector = OutlierDetectors.create(method);
        if (values.length == 0) {
            return DataQualityReport.empty();
        }

        List<OutlierResult> results = detector.detect(values);
        List<Integer> outliers = new ArrayList<>();
        List<Double> clean = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (results.get(i).isOutlier()) {
                outliers.add(i);
            } else {
                clean.add(values[i]);
            }
        }

        SeriesStatistics statistics = new SeriesStatistics(
                Statistics.mean(values),
                Statistics.median(values),
                Statistics.stdDev(values),
                Statistics.iqr(values),
                Statistics.mad(values));

        double percentage = 100.0 * outliers.size() / values.length;
        LOG.debug("{} flagged {}/{} points ({}%)", method.getKey(), outliers.size(), values.length, percentage);
        return new DataQualityReport(values.length, outliers, percentage, clean, statistics);
    }
}
