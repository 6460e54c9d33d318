/**
 * Least-squares regression solved through the normal equations: ordinary,
 * ridge, exponentially time-weighted and polynomial variants.
 *
 * <p>
 * {@link com.traininginsight.core.regression.RegressionFitter} produces
 * immutable {@link com.traininginsight.core.regression.RegressionModel}s;
 * metrics are always measured against the unweighted targets.
 * </p>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.regression;
