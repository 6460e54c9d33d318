package com.traininginsight.core.detection;

import java.util.List;

/**
 * Contract for univariate outlier detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: every call scores the
 * supplied series from scratch, and the returned list has exactly one
 * {@link OutlierResult} per input value, in input order.
 * </p>
 */
public interface OutlierDetector {

    /**
     * Score every value of the series.
     *
     * @param values the series; must not be {@code null}
     * @return one result per value, in the same order
     */
    List<OutlierResult> detect(double[] values);

    /**
     * @return the statistical test this detector applies
     */
    OutlierMethod getMethod();
}
