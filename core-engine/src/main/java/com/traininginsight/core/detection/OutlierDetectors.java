package com.traininginsight.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates univariate {@link OutlierDetector} instances from an
 * {@link OutlierMethod}.
 *
 * <p>
 * This is the single point of extension when adding new univariate tests:
 * register the method here and create the corresponding detector.
 * {@link OutlierMethod#MAHALANOBIS} scores feature vectors rather than a
 * series and is built directly via {@link MahalanobisOutlierDetector}.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutlierDetectors {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierDetectors.class);

    private OutlierDetectors() {
        // utility class
    }

    /**
     * Create a detector with the method's default threshold.
     *
     * @param method detection method; must not be {@code null}
     * @return a new detector
     * @throws IllegalArgumentException if the method is not univariate
     */
    public static OutlierDetector create(OutlierMethod method) {
        Objects.requireNonNull(method, "Outlier method must not be null");
        return switch (method) {
            case Z_SCORE -> new ZScoreOutlierDetector();
            case MODIFIED_Z_SCORE -> new ModifiedZScoreOutlierDetector();
            case IQR -> new IqrOutlierDetector();
            case TIME_SERIES_WINDOW -> new TimeSeriesWindowOutlierDetector();
            case MAHALANOBIS -> throw multivariate(method);
        };
    }

    /**
     * Create a detector with an explicit threshold (the fence multiplier for
     * {@link OutlierMethod#IQR}).
     *
     * @param method    detection method; must not be {@code null}
     * @param threshold method-specific threshold
     * @return a new detector
     * @throws IllegalArgumentException if the method is not univariate or the
     *                                  threshold is invalid
     */
    public static OutlierDetector create(OutlierMethod method, double threshold) {
        Objects.requireNonNull(method, "Outlier method must not be null");
        LOG.debug("Creating {} detector with threshold {}", method.getKey(), threshold);
        return switch (method) {
            case Z_SCORE -> new ZScoreOutlierDetector(threshold);
            case MODIFIED_Z_SCORE -> new ModifiedZScoreOutlierDetector(threshold);
            case IQR -> new IqrOutlierDetector(threshold);
            case TIME_SERIES_WINDOW -> new TimeSeriesWindowOutlierDetector(
                    TimeSeriesWindowOutlierDetector.DEFAULT_WINDOW_SIZE, threshold);
            case MAHALANOBIS -> throw multivariate(method);
        };
    }

    private static IllegalArgumentException multivariate(OutlierMethod method) {
        return new IllegalArgumentException("Outlier method '" + method.getKey()
                + "' scores feature vectors; use MahalanobisOutlierDetector directly");
    }
}
