/**
 * End-to-end learning run.
 *
 * <p>
 * {@link com.traininginsight.core.loop.LearningLoopController} cleans,
 * featurizes, fits, ensembles and narrates in one synchronous call and
 * returns a {@link com.traininginsight.core.loop.LearningLoopResult}.
 * Nothing is kept between calls; earlier prediction errors come back in
 * through {@link com.traininginsight.core.loop.PredictionHistory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.loop;
