package com.traininginsight.core.forecast;

import com.traininginsight.core.math.Statistics;
import com.traininginsight.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Univariate short-horizon forecasting.
 *
 * <ul>
 * <li>{@link #tripleExponentialSmoothing}: Holt level/trend smoothing</li>
 * <li>{@link #adaptiveMovingAverage}: flat moving-average forecast with the
 * window chosen by one-step-ahead backtest</li>
 * </ul>
 * <p>
 * Both report a confidence {@code max(0, 1 - mse / variance)} and a ±1.96σ
 * band. Points are used in list order.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesForecaster {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesForecaster.class);

    public static final String SMOOTHING_METHOD = "triple_exponential_smoothing";
    public static final String MOVING_AVERAGE_PREFIX = "moving_average_";

    static final double DEFAULT_ALPHA = 0.3;
    static final double DEFAULT_BETA = 0.1;
    static final int DEFAULT_HORIZON = 7;
    static final int DEFAULT_PERIOD = 7;
    static final int DEFAULT_MAX_LAG = 14;

    /** Candidate moving-average windows, tried in order. */
    static final int[] WINDOWS = {3, 5, 7, 10, 14};

    private static final int FALLBACK_WINDOW = 7;
    private static final double Z_95 = 1.96;

    private TimeSeriesForecaster() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Holt smoothing
    // ---------------------------------------------------------------

    public static ForecastResult tripleExponentialSmoothing(List<TimeSeriesPoint> series) {
        return tripleExponentialSmoothing(series, DEFAULT_ALPHA, DEFAULT_BETA, DEFAULT_HORIZON);
    }

    /**
     * Holt smoothing with level {@code α} and trend {@code β}.
     *
     * @param series  observations in time order
     * @param alpha   level smoothing factor in (0, 1]
     * @param beta    trend smoothing factor in [0, 1]
     * @param horizon number of steps to forecast
     * @return forecast; empty with confidence 0 for fewer than 3 points
     */
    public static ForecastResult tripleExponentialSmoothing(List<TimeSeriesPoint> series,
                                                            double alpha, double beta, int horizon) {
        Objects.requireNonNull(series, "series must not be null");
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
        if (beta < 0 || beta > 1) {
            throw new IllegalArgumentException("beta must be in [0, 1], got: " + beta);
        }
        requirePositiveHorizon(horizon);

        double[] values = values(series);
        int n = values.length;
        if (n < 3) {
            return ForecastResult.empty(SMOOTHING_METHOD);
        }

        double level = values[0];
        double trend = (values[n - 1] - values[0]) / n;
        double[] levels = new double[n];
        levels[0] = level;

        for (int i = 1; i < n; i++) {
            double prevLevel = level;
            double prevTrend = trend;
            level = alpha * values[i] + (1 - alpha) * (prevLevel + prevTrend);
            trend = beta * (level - prevLevel) + (1 - beta) * prevTrend;
            levels[i] = level;
        }

        double sumSquares = 0;
        for (int i = 0; i < n; i++) {
            double r = values[i] - levels[i];
            sumSquares += r * r;
        }
        double sigma = Math.sqrt(sumSquares / (n - 1));
        double mse = sumSquares / n;

        List<Double> predictions = new ArrayList<>(horizon);
        List<Double> lower = new ArrayList<>(horizon);
        List<Double> upper = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            double p = level + h * trend;
            predictions.add(p);
            lower.add(p - Z_95 * sigma);
            upper.add(p + Z_95 * sigma);
        }

        double confidence = fitConfidence(mse, Statistics.variance(values));
        LOG.debug("Holt smoothing over {} point(s): level={} trend={} confidence={}", n, level, trend, confidence);
        return new ForecastResult(predictions, lower, upper, confidence, SMOOTHING_METHOD);
    }

    // ---------------------------------------------------------------
    // Adaptive moving average
    // ---------------------------------------------------------------

    public static ForecastResult adaptiveMovingAverage(List<TimeSeriesPoint> series) {
        return adaptiveMovingAverage(series, DEFAULT_HORIZON);
    }

    /**
     * Flat moving-average forecast. Windows larger than half the series are
     * skipped; the window with the lowest one-step-ahead backtest MSE wins.
     *
     * <p>
     * When no window fits, the forecast is the mean of the last
     * {@code min(7, n)} values with unbounded band and confidence 0.
     * </p>
     *
     * @param series  observations in time order
     * @param horizon number of steps to forecast
     * @return forecast; empty for an empty series
     */
    public static ForecastResult adaptiveMovingAverage(List<TimeSeriesPoint> series, int horizon) {
        Objects.requireNonNull(series, "series must not be null");
        requirePositiveHorizon(horizon);

        double[] values = values(series);
        int n = values.length;
        if (n == 0) {
            return ForecastResult.empty(MOVING_AVERAGE_PREFIX + FALLBACK_WINDOW);
        }

        int bestWindow = -1;
        double bestMse = Double.POSITIVE_INFINITY;
        for (int window : WINDOWS) {
            if (window > n / 2.0) {
                continue;
            }
            double sumSquares = 0;
            for (int i = window; i < n; i++) {
                double error = mean(values, i - window, i) - values[i];
                sumSquares += error * error;
            }
            double mse = sumSquares / (n - window);
            LOG.trace("Moving-average window {} backtest mse={}", window, mse);
            if (mse < bestMse) {
                bestMse = mse;
                bestWindow = window;
            }
        }

        int window = bestWindow > 0 ? bestWindow : Math.min(FALLBACK_WINDOW, n);
        double forecast = mean(values, n - window, n);
        double sigma = Math.sqrt(bestMse);
        double confidence = bestWindow > 0 ? fitConfidence(bestMse, Statistics.variance(values)) : 0;

        List<Double> predictions = new ArrayList<>(Collections.nCopies(horizon, forecast));
        List<Double> lower = new ArrayList<>(Collections.nCopies(horizon, forecast - Z_95 * sigma));
        List<Double> upper = new ArrayList<>(Collections.nCopies(horizon, forecast + Z_95 * sigma));

        String method = MOVING_AVERAGE_PREFIX + (bestWindow > 0 ? bestWindow : FALLBACK_WINDOW);
        LOG.debug("Adaptive moving average over {} point(s): method={} confidence={}", n, method, confidence);
        return new ForecastResult(predictions, lower, upper, confidence, method);
    }

    // ---------------------------------------------------------------
    // Structure
    // ---------------------------------------------------------------

    public static SeriesDecomposition decompose(List<TimeSeriesPoint> series) {
        return decompose(series, DEFAULT_PERIOD);
    }

    /**
     * Classical additive decomposition: centered moving-average trend with
     * edges held flat, seasonal component from per-phase means of the
     * detrended series (centered to sum to zero), residual as remainder.
     *
     * @param series observations in time order
     * @param period season length in points; must be at least 2
     * @return decomposition; a series shorter than {@code 2 * period} is all
     *         trend
     */
    public static SeriesDecomposition decompose(List<TimeSeriesPoint> series, int period) {
        Objects.requireNonNull(series, "series must not be null");
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
        double[] values = values(series);
        int n = values.length;

        if (n < period * 2) {
            return new SeriesDecomposition(toList(values), Collections.nCopies(n, 0.0), Collections.nCopies(n, 0.0));
        }

        double[] trend = new double[n];
        int half = period / 2;
        for (int i = half; i < n - half; i++) {
            double sum = 0;
            for (int j = i - half; j <= i + half; j++) {
                sum += values[j];
            }
            trend[i] = sum / period;
        }
        for (int i = 0; i < half; i++) {
            trend[i] = trend[half];
            trend[n - 1 - i] = trend[n - 1 - half];
        }

        double[] phaseMeans = new double[period];
        int[] phaseCounts = new int[period];
        for (int i = 0; i < n; i++) {
            phaseMeans[i % period] += values[i] - trend[i];
            phaseCounts[i % period]++;
        }
        double overall = 0;
        for (int p = 0; p < period; p++) {
            phaseMeans[p] /= phaseCounts[p];
            overall += phaseMeans[p];
        }
        overall /= period;

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = phaseMeans[i % period] - overall;
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeriesDecomposition(toList(trend), toList(seasonal), toList(residual));
    }

    public static List<Double> autocorrelation(List<TimeSeriesPoint> series) {
        return autocorrelation(series, DEFAULT_MAX_LAG);
    }

    /**
     * Sample autocorrelation for lags {@code 0..min(maxLag, n-1)}.
     *
     * <p>
     * A constant series has no defined correlation; it reports 1 at lag 0
     * and 0 at every other lag.
     * </p>
     */
    public static List<Double> autocorrelation(List<TimeSeriesPoint> series, int maxLag) {
        Objects.requireNonNull(series, "series must not be null");
        if (maxLag < 0) {
            throw new IllegalArgumentException("maxLag must be >= 0, got: " + maxLag);
        }
        double[] values = values(series);
        int n = values.length;
        if (n == 0) {
            return Collections.emptyList();
        }

        double mean = Statistics.mean(values);
        double variance = Statistics.variance(values);

        List<Double> result = new ArrayList<>();
        for (int lag = 0; lag <= maxLag && lag < n; lag++) {
            if (variance == 0) {
                result.add(lag == 0 ? 1.0 : 0.0);
                continue;
            }
            double sum = 0;
            for (int i = lag; i < n; i++) {
                sum += (values[i] - mean) * (values[i - lag] - mean);
            }
            result.add(sum / n / variance);
        }
        return Collections.unmodifiableList(result);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double fitConfidence(double mse, double variance) {
        if (variance == 0) {
            return mse == 0 ? 1 : 0;
        }
        return Math.max(0, 1 - mse / variance);
    }

    private static double[] values(List<TimeSeriesPoint> series) {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        return values;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }

    private static void requirePositiveHorizon(int horizon) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be > 0, got: " + horizon);
        }
    }
}
