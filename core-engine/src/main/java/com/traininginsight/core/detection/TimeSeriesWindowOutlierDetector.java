package com.traininginsight.core.detection;

import com.traininginsight.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Local outlier detector based on a centered moving window.
 *
 * <p>
 * For every index the detector takes up to {@code windowSize} neighbours on
 * each side, <em>excluding the point itself</em>, and flags the point when
 * its distance from the window mean exceeds {@code threshold × σ}. Windows
 * shrink at the edges of the series instead of wrapping around.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Unlike a streaming detector this one sees the whole series at once; the
 * window is recomputed per index and nothing is retained between calls.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesWindowOutlierDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesWindowOutlierDetector.class);

    static final int DEFAULT_WINDOW_SIZE = 7;
    static final double DEFAULT_THRESHOLD = 2.5;

    private final int windowSize;
    private final double threshold;

    public TimeSeriesWindowOutlierDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_THRESHOLD);
    }

    /**
     * @param windowSize neighbours considered on each side; must be &gt;= 1
     * @param threshold  local z-score above which a point is flagged
     */
    public TimeSeriesWindowOutlierDetector(int windowSize, double threshold) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.windowSize = windowSize;
        this.threshold = threshold;
    }

    /**
     * Score a timestamped series in its given order.
     *
     * @param series the series; must not be {@code null}
     * @return one result per point
     */
    public List<OutlierResult> detectSeries(List<TimeSeriesPoint> series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        return detect(values);
    }

    @Override
    public List<OutlierResult> detect(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        List<OutlierResult> results = new ArrayList<>(values.length);

        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - windowSize);
            int end = Math.min(values.length, i + windowSize + 1);
            int count = end - start - 1;

            if (count == 0) {
                results.add(OutlierResult.inlier(0, getMethod()));
                continue;
            }

            double mean = computeMean(values, start, end, i, count);
            double stdDev = computeStdDev(values, start, end, i, count, mean);
            double z = stdDev == 0 ? 0 : Math.abs((values[i] - mean) / stdDev);

            if (z > threshold) {
                LOG.trace("Local outlier at index {}: value={} mean={} stddev={}", i, values[i], mean, stdDev);
                results.add(new OutlierResult(true, z, getMethod().getKey(), String.format(Locale.ROOT,
                        "%.2fσ from local window (expected: %.1f ± %.1f)", z, mean, stdDev)));
            } else {
                results.add(OutlierResult.inlier(z, getMethod()));
            }
        }
        return results;
    }

    @Override
    public OutlierMethod getMethod() {
        return OutlierMethod.TIME_SERIES_WINDOW;
    }

    // ---------------------------------------------------------------
    // Window statistics (index `skip` excluded)
    // ---------------------------------------------------------------

    private static double computeMean(double[] values, int start, int end, int skip, int count) {
        double sum = 0;
        for (int j = start; j < end; j++) {
            if (j != skip) {
                sum += values[j];
            }
        }
        return sum / count;
    }

    private static double computeStdDev(double[] values, int start, int end, int skip, int count, double mean) {
        double sumSquaredDiff = 0;
        for (int j = start; j < end; j++) {
            if (j != skip) {
                double diff = values[j] - mean;
                sumSquaredDiff += diff * diff;
            }
        }
        return Math.sqrt(sumSquaredDiff / count);
    }
}
