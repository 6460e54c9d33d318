package com.traininginsight.core.detection;

import com.traininginsight.core.math.Matrices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Multi-feature detector using the Mahalanobis distance.
 *
 * <p>
 * The mean vector and (population) covariance matrix are estimated from all
 * points; each point is scored as {@code sqrt(|dᵀ Σ⁻¹ d|)} with
 * {@code d = x - mean}. A singular covariance matrix is replaced by the
 * identity, degrading to a Euclidean distance over independent features
 * rather than failing.
 * </p>
 *
 * @since 1.0.0
 */
public class MahalanobisOutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MahalanobisOutlierDetector.class);

    static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public MahalanobisOutlierDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public MahalanobisOutlierDetector(double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * Score every feature vector.
     *
     * @param points feature vectors of equal length; must not be {@code null}
     * @return one result per point, in input order
     * @throws IllegalArgumentException if vectors differ in length
     */
    public List<OutlierResult> detect(List<double[]> points) {
        Objects.requireNonNull(points, "points must not be null");
        List<OutlierResult> results = new ArrayList<>(points.size());
        if (points.isEmpty()) {
            return results;
        }

        int m = points.get(0).length;
        for (double[] p : points) {
            if (p.length != m) {
                throw new IllegalArgumentException("All feature vectors must have length " + m
                        + ", got " + p.length);
            }
        }

        double[] means = meanVector(points, m);
        double[][] inverse = Matrices.invertOrIdentity(covariance(points, means, m));

        for (double[] p : points) {
            double[] diff = new double[m];
            for (int i = 0; i < m; i++) {
                diff[i] = p[i] - means[i];
            }
            double distance = Math.sqrt(Math.abs(Matrices.quadraticForm(diff, inverse)));
            if (distance > threshold) {
                results.add(new OutlierResult(true, distance, OutlierMethod.MAHALANOBIS.getKey(),
                        String.format(Locale.ROOT, "Mahalanobis distance: %.2f", distance)));
            } else {
                results.add(OutlierResult.inlier(distance, OutlierMethod.MAHALANOBIS));
            }
        }
        LOG.debug("Mahalanobis scoring over {} points x {} features complete", points.size(), m);
        return results;
    }

    public double getThreshold() {
        return threshold;
    }

    private static double[] meanVector(List<double[]> points, int m) {
        double[] means = new double[m];
        for (double[] p : points) {
            for (int i = 0; i < m; i++) {
                means[i] += p[i];
            }
        }
        for (int i = 0; i < m; i++) {
            means[i] /= points.size();
        }
        return means;
    }

    private static double[][] covariance(List<double[]> points, double[] means, int m) {
        double[][] cov = new double[m][m];
        for (double[] p : points) {
            for (int i = 0; i < m; i++) {
                for (int j = 0; j < m; j++) {
                    cov[i][j] += (p[i] - means[i]) * (p[j] - means[j]);
                }
            }
        }
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < m; j++) {
                cov[i][j] /= points.size();
            }
        }
        return cov;
    }
}
