package com.traininginsight.core.trend;

import com.traininginsight.core.feature.FeatureEngineer;
import com.traininginsight.core.math.Statistics;
import com.traininginsight.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Distribution-free monotonic trend test.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Kendall's {@code S = Σ_{i<j} sign(x_j - x_i)}.</li>
 * <li>{@code Var(S) = n(n-1)(2n+5)/18} under the null hypothesis.</li>
 * <li>{@code Z = (S - 1)/√Var} for {@code S > 0}, {@code (S + 1)/√Var} for
 * {@code S < 0}, 0 otherwise.</li>
 * <li>Two-tailed p-value from the standard normal CDF.</li>
 * <li>Sen's slope: median of pairwise slopes per day over strictly positive
 * time gaps.</li>
 * <li>Direction: the sign of {@code S} when {@code p < 0.05}, otherwise
 * stable.</li>
 * </ol>
 *
 * <p>
 * Points are analysed in timestamp order; the caller's list is not
 * modified. Pure static utility, no state.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    /** p-value below which a trend is reported as increasing/decreasing. */
    public static final double SIGNIFICANCE_LEVEL = 0.05;

    static final int MIN_POINTS = 4;

    private TrendAnalyzer() {
        // utility class
    }

    /**
     * Run the Mann-Kendall test.
     *
     * @param series the series; must not be {@code null}
     * @return trend analysis, {@link TrendAnalysis#none()} for fewer than
     *         {@value #MIN_POINTS} points
     */
    public static TrendAnalysis detectTrend(List<TimeSeriesPoint> series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < MIN_POINTS) {
            LOG.debug("Trend test skipped: {} point(s) < {}", n, MIN_POINTS);
            return TrendAnalysis.none();
        }

        List<TimeSeriesPoint> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparing(TimeSeriesPoint::getTimestamp));

        long s = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                s += (long) Math.signum(ordered.get(j).getValue() - ordered.get(i).getValue());
            }
        }

        double stdS = Math.sqrt(n * (n - 1.0) * (2.0 * n + 5) / 18.0);
        double z;
        if (s > 0) {
            z = (s - 1) / stdS;
        } else if (s < 0) {
            z = (s + 1) / stdS;
        } else {
            z = 0;
        }

        double pValue = 2 * (1 - normalCdf(Math.abs(z)));
        double tau = s / (n * (n - 1) / 2.0);
        double slope = sensSlope(ordered);

        TrendDirection direction;
        if (pValue < SIGNIFICANCE_LEVEL) {
            // direction follows S; with heavy ties Sen's slope can be exactly 0
            direction = s > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        } else {
            direction = TrendDirection.STABLE;
        }

        LOG.debug("Mann-Kendall: n={} S={} Z={} p={} slope={} -> {}", n, s, z, pValue, slope, direction.getKey());
        return new TrendAnalysis(direction, slope, 1 - pValue, pValue, tau);
    }

    /**
     * Standard normal CDF, Abramowitz and Stegun formula 26.2.17
     * (absolute error below 7.5e-8).
     */
    static double normalCdf(double z) {
        double t = 1 / (1 + 0.2316419 * Math.abs(z));
        double d = 0.3989423 * Math.exp(-z * z / 2);
        double p = d * t * (0.3193815 + t * (-0.3565638 + t * (1.781478 + t * (-1.821256 + t * 1.330274))));
        return z > 0 ? 1 - p : p;
    }

    private static double sensSlope(List<TimeSeriesPoint> ordered) {
        int n = ordered.size();
        List<Double> slopes = new ArrayList<>();
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                double days = FeatureEngineer.daysBetween(ordered.get(i).getTimestamp(), ordered.get(j).getTimestamp());
                if (days > 0) {
                    slopes.add((ordered.get(j).getValue() - ordered.get(i).getValue()) / days);
                }
            }
        }
        if (slopes.isEmpty()) {
            return 0;
        }
        return Statistics.median(slopes.stream().mapToDouble(Double::doubleValue).toArray());
    }
}
