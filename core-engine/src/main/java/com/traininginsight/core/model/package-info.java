/**
 * Input-side domain model shared by every learning component.
 *
 * <ul>
 * <li>{@link com.traininginsight.core.model.Observation}: one training
 * session as supplied by the caller</li>
 * <li>{@link com.traininginsight.core.model.DataPoint}: featurized
 * observation used for fitting</li>
 * <li>{@link com.traininginsight.core.model.TimeSeriesPoint}: timestamped
 * scalar for trend analysis and forecasting</li>
 * <li>{@link com.traininginsight.core.model.TargetVariable}: which field is
 * predicted</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.model;
