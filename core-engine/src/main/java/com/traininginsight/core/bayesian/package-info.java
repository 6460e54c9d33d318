/**
 * Sequential Bayesian linear regression.
 *
 * <p>
 * {@link com.traininginsight.core.bayesian.BayesianModel} is an immutable
 * Normal-Gamma posterior; every operation of
 * {@link com.traininginsight.core.bayesian.BayesianUpdater} returns a new
 * value, so fitting is a fold over the observations.
 * </p>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.bayesian;
