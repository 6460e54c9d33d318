/**
 * Ensemble assembly and combination.
 *
 * <p>
 * {@link com.traininginsight.core.ensemble.EnsembleBuilder} collects
 * {@link com.traininginsight.core.ensemble.EnsembleMember}s and
 * {@link com.traininginsight.core.ensemble.EnsembleCombiner} merges them
 * into an {@link com.traininginsight.core.ensemble.EnsemblePrediction}
 * using one of the {@link com.traininginsight.core.ensemble.EnsembleStrategy}
 * values.
 * </p>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.ensemble;
