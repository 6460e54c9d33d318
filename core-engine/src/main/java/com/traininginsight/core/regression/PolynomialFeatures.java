package com.traininginsight.core.regression;

/**
 * Polynomial basis expansion.
 *
 * <p>
 * Output layout for {@code m} inputs: the {@code m} originals, then (degree
 * &gt;= 2) {@code m} squares followed by the {@code m(m-1)/2} pairwise
 * products in {@code (i, j > i)} order, then (degree &gt;= 3) {@code m} cubes.
 * </p>
 */
final class PolynomialFeatures {

    private PolynomialFeatures() {
    }

    static double[] expand(double[] features, int degree) {
        int m = features.length;
        int size = m;
        if (degree >= 2) {
            size += m + m * (m - 1) / 2;
        }
        if (degree >= 3) {
            size += m;
        }

        double[] out = new double[size];
        System.arraycopy(features, 0, out, 0, m);
        int k = m;
        if (degree >= 2) {
            for (int i = 0; i < m; i++) {
                out[k++] = features[i] * features[i];
            }
            for (int i = 0; i < m; i++) {
                for (int j = i + 1; j < m; j++) {
                    out[k++] = features[i] * features[j];
                }
            }
        }
        if (degree >= 3) {
            for (int i = 0; i < m; i++) {
                out[k++] = features[i] * features[i] * features[i];
            }
        }
        return out;
    }
}
