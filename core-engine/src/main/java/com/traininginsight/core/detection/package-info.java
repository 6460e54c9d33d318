/**
 * Outlier detection and data-quality reporting.
 *
 * <p>
 * Univariate detectors implement
 * {@link com.traininginsight.core.detection.OutlierDetector} and are
 * instantiated via {@link com.traininginsight.core.detection.OutlierDetectors}:
 * </p>
 * <ul>
 * <li>{@link com.traininginsight.core.detection.ZScoreOutlierDetector}:
 * mean ± N × σ</li>
 * <li>{@link com.traininginsight.core.detection.ModifiedZScoreOutlierDetector}:
 * median / MAD, robust to the outliers it is looking for</li>
 * <li>{@link com.traininginsight.core.detection.IqrOutlierDetector}: Tukey
 * fences</li>
 * <li>{@link com.traininginsight.core.detection.TimeSeriesWindowOutlierDetector}:
 * local z-score in a centered window</li>
 * </ul>
 * <p>
 * {@link com.traininginsight.core.detection.MahalanobisOutlierDetector}
 * scores whole feature vectors.
 * {@link com.traininginsight.core.detection.DataQualityAnalyzer} turns a
 * detector run into a {@link com.traininginsight.core.detection.DataQualityReport}.
 * </p>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.detection;
