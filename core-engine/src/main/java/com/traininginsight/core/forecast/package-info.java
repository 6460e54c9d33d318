/**
 * Short-horizon forecasting over a single training-load series, plus
 * decomposition and autocorrelation helpers.
 *
 * @since 1.0.0
 */
package com.traininginsight.core.forecast;
