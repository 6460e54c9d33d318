/**
 * JSON encoding of observations and learning results, via Jackson.
 *
 * @since 1.0.0
 */
package com.traininginsight.core.json;
