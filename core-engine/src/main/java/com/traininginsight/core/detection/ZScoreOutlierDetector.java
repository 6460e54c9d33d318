package com.traininginsight.core.detection;

import com.traininginsight.core.math.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Classic Z-score detector.
 *
 * <p>
 * A value is an outlier when {@code |x - mean| / σ > threshold}, using the
 * population standard deviation of the whole series. A constant series has
 * {@code σ = 0}; every score is then defined as 0 and nothing is flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreOutlierDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreOutlierDetector.class);

    static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public ZScoreOutlierDetector() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold number of standard deviations; must be positive
     */
    public ZScoreOutlierDetector(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public List<OutlierResult> detect(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        List<OutlierResult> results = new ArrayList<>(values.length);
        if (values.length == 0) {
            return results;
        }

        double mean = Statistics.mean(values);
        double stdDev = Statistics.stdDev(values);

        for (double value : values) {
            double z = stdDev == 0 ? 0 : Math.abs((value - mean) / stdDev);
            if (z > threshold) {
                LOG.trace("z-score outlier: value={} z={}", value, z);
                results.add(new OutlierResult(true, z, getMethod().getKey(), String.format(Locale.ROOT,
                        "%.2f standard deviations from mean (threshold: %.1f)", z, threshold)));
            } else {
                results.add(OutlierResult.inlier(z, getMethod()));
            }
        }
        return results;
    }

    @Override
    public OutlierMethod getMethod() {
        return OutlierMethod.Z_SCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
