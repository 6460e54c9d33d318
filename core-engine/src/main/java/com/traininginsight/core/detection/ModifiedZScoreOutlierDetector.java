package com.traininginsight.core.detection;

import com.traininginsight.core.math.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Robust detector based on the median absolute deviation (Iglewicz and
 * Hoaglin's modified Z-score).
 *
 * <pre>
 *   M = 0.6745 * (x - median) / MAD
 *   outlier  iff  |M| &gt; threshold   (default 3.5)
 * </pre>
 *
 * <p>
 * A zero MAD (more than half the values identical) yields a score of 0 for
 * every point, so constant data never produces false positives.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreOutlierDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ModifiedZScoreOutlierDetector.class);

    static final double DEFAULT_THRESHOLD = 3.5;

    /** Converts MAD to a standard-deviation-consistent scale. */
    private static final double CONSISTENCY_CONSTANT = 0.6745;

    private final double threshold;

    public ModifiedZScoreOutlierDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public ModifiedZScoreOutlierDetector(double threshold) {
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

        double median = Statistics.median(values);
        double mad = Statistics.mad(values);

        for (double value : values) {
            double score = mad == 0 ? 0 : Math.abs(CONSISTENCY_CONSTANT * (value - median) / mad);
            if (score > threshold) {
                LOG.trace("Modified z-score outlier: value={} score={} median={} mad={}",
                        value, score, median, mad);
                results.add(new OutlierResult(true, score, getMethod().getKey(), String.format(Locale.ROOT,
                        "Modified Z-score: %.2f (threshold: %.1f)", score, threshold)));
            } else {
                results.add(OutlierResult.inlier(score, getMethod()));
            }
        }
        return results;
    }

    @Override
    public OutlierMethod getMethod() {
        return OutlierMethod.MODIFIED_Z_SCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
