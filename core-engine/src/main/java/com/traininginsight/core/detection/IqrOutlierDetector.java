package com.traininginsight.core.detection;

import com.traininginsight.core.math.Statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tukey fences.
 *
 * <p>
 * Values outside {@code [Q1 - k·IQR, Q3 + k·IQR]} are outliers. The score is
 * the distance outside the nearer fence expressed in IQR units, or 0 inside
 * the fences. When the IQR is 0 the raw distance is reported instead so the
 * score stays finite.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrOutlierDetector implements OutlierDetector {

    static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public IqrOutlierDetector() {
        this(DEFAULT_MULTIPLIER);
    }

    /**
     * @param multiplier fence width {@code k}; must be non-negative
     */
    public IqrOutlierDetector(double multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("multiplier must be >= 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public List<OutlierResult> detect(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        List<OutlierResult> results = new ArrayList<>(values.length);
        if (values.length == 0) {
            return results;
        }

        double[] sorted = Statistics.sorted(values);
        double q1 = Statistics.quantile(sorted, 0.25);
        double q3 = Statistics.quantile(sorted, 0.75);
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;
        double scale = iqr == 0 ? 1 : iqr;

        for (double value : values) {
            if (value < lower || value > upper) {
                double distance = value < lower ? lower - value : value - upper;
                results.add(new OutlierResult(true, distance / scale, getMethod().getKey(),
                        String.format(Locale.ROOT, "Outside bounds [%.1f, %.1f]", lower, upper)));
            } else {
                results.add(OutlierResult.inlier(0, getMethod()));
            }
        }
        return results;
    }

    @Override
    public OutlierMethod getMethod() {
        return OutlierMethod.IQR;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
