/**
 * Configuration loading and validation for learning runs.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.traininginsight.core.config.LearningConfigLoader} into a
 * {@link com.traininginsight.core.config.LearningConfig}, validated right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.traininginsight.core.config;
