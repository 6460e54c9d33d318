/**
 * Mann-Kendall trend test with Sen's slope.
 *
 * @since 1.0.0
 */
package com.traininginsight.core.trend;
