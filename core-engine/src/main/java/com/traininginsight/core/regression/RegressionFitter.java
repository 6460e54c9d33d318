package com.traininginsight.core.regression;

import com.traininginsight.core.feature.FeatureEngineer;
import com.traininginsight.core.math.Matrices;
import com.traininginsight.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Least-squares fitting via the normal equations.
 *
 * <p>
 * The design matrix gets a leading column of ones for the intercept and the
 * (optionally weighted, optionally penalized) system
 * </p>
 * <pre>
 *   (XᵀWX + λD) β = XᵀWy        D = diag(0, 1, ..., 1)
 * </pre>
 * <p>
 * is solved with partial-pivoting LU. Fit metrics are always computed
 * against the unweighted targets.
 * </p>
 *
 * <p>This class is stateless apart from its clock and is thread-safe.</p>
 *
 * @since 1.0.0
 */
public class RegressionFitter {

    private static final Logger LOG = LoggerFactory.getLogger(RegressionFitter.class);

    public static final double DEFAULT_RIDGE_LAMBDA = 0.1;
    public static final double DEFAULT_HALF_LIFE_DAYS = 30;
    public static final int DEFAULT_POLYNOMIAL_DEGREE = 2;

    /** Penalty applied to the expanded polynomial basis. */
    static final double POLYNOMIAL_LAMBDA = 0.01;

    private final Clock clock;

    public RegressionFitter() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of "now" for time weighting and {@code createdAt}
     */
    public RegressionFitter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Fit with the variant's default parameters.
     *
     * @param points training data; must not be empty
     * @param type   fitting strategy
     * @return a new model
     */
    public RegressionModel fit(List<DataPoint> points, RegressionType type) {
        Objects.requireNonNull(type, "Regression type must not be null");
        return switch (type) {
            case LINEAR -> fitLinear(points);
            case RIDGE -> fitRidge(points, DEFAULT_RIDGE_LAMBDA);
            case TIME_WEIGHTED -> fitTimeWeighted(points, DEFAULT_HALF_LIFE_DAYS);
            case POLYNOMIAL -> fitPolynomial(points, DEFAULT_POLYNOMIAL_DEGREE);
        };
    }

    /**
     * Ordinary least squares.
     */
    public RegressionModel fitLinear(List<DataPoint> points) {
        requireUsable(points);
        double[] beta = solve(points, unitWeights(points.size()), 0);
        return buildModel(points, beta, RegressionType.LINEAR, 0);
    }

    /**
     * L2-penalized least squares; the intercept is not penalized.
     *
     * @param lambda penalty, {@code >= 0}; 0 reproduces OLS
     */
    public RegressionModel fitRidge(List<DataPoint> points, double lambda) {
        requireUsable(points);
        if (lambda < 0) {
            throw new IllegalArgumentException("lambda must be >= 0, got: " + lambda);
        }
        double[] beta = solve(points, unitWeights(points.size()), lambda);
        return buildModel(points, beta, RegressionType.RIDGE, 0);
    }

    /**
     * Weighted least squares with exponential time decay
     * {@code w = exp(-ln2 · daysAgo / halfLife)}; points without a timestamp
     * get weight 1.
     *
     * @param halfLifeDays decay half-life; must be positive
     */
    public RegressionModel fitTimeWeighted(List<DataPoint> points, double halfLifeDays) {
        requireUsable(points);
        if (halfLifeDays <= 0) {
            throw new IllegalArgumentException("halfLifeDays must be > 0, got: " + halfLifeDays);
        }
        Instant now = clock.instant();
        double[] weights = new double[points.size()];
        for (int i = 0; i < weights.length; i++) {
            Instant ts = points.get(i).getTimestamp();
            weights[i] = ts == null
                    ? 1
                    : Math.exp(-Math.log(2) * FeatureEngineer.daysBetween(ts, now) / halfLifeDays);
        }
        double[] beta = solve(points, weights, 0);
        return buildModel(points, beta, RegressionType.TIME_WEIGHTED, 0);
    }

    /**
     * Polynomial expansion (squares, pairwise interactions and, for degree
     * &gt;= 3, cubes) followed by a ridge fit with λ = {@value #POLYNOMIAL_LAMBDA}.
     *
     * @param degree 2 or higher
     */
    public RegressionModel fitPolynomial(List<DataPoint> points, int degree) {
        requireUsable(points);
        if (degree < 2) {
            throw new IllegalArgumentException("degree must be >= 2, got: " + degree);
        }
        List<DataPoint> expanded = new ArrayList<>(points.size());
        for (DataPoint p : points) {
            expanded.add(p.withFeatures(PolynomialFeatures.expand(p.getFeatures(), degree)));
        }
        double[] beta = solve(expanded, unitWeights(expanded.size()), POLYNOMIAL_LAMBDA);
        return buildModel(expanded, beta, RegressionType.POLYNOMIAL, degree);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double[] solve(List<DataPoint> points, double[] weights, double lambda) {
        int p = points.get(0).dimension() + 1;
        double[][] xtwx = new double[p][p];
        double[] xtwy = new double[p];
        double[] row = new double[p];

        for (int n = 0; n < points.size(); n++) {
            DataPoint point = points.get(n);
            row[0] = 1;
            for (int j = 1; j < p; j++) {
                row[j] = point.feature(j - 1);
            }
            double w = weights[n];
            for (int i = 0; i < p; i++) {
                double wx = w * row[i];
                xtwy[i] += wx * point.getTarget();
                for (int j = 0; j < p; j++) {
                    xtwx[i][j] += wx * row[j];
                }
            }
        }

        for (int i = 1; i < p; i++) {
            xtwx[i][i] += lambda;
        }
        return Matrices.solve(xtwx, xtwy);
    }

    private RegressionModel buildModel(List<DataPoint> points, double[] beta, RegressionType type, int degree) {
        int n = points.size();
        double[] coefficients = new double[beta.length - 1];
        System.arraycopy(beta, 1, coefficients, 0, coefficients.length);

        double meanTarget = 0;
        for (DataPoint p : points) {
            meanTarget += p.getTarget();
        }
        meanTarget /= n;

        double ssRes = 0;
        double ssTot = 0;
        double sumAbsError = 0;
        for (DataPoint p : points) {
            double predicted = beta[0];
            for (int j = 0; j < coefficients.length; j++) {
                predicted += coefficients[j] * p.feature(j);
            }
            double error = p.getTarget() - predicted;
            ssRes += error * error;
            ssTot += (p.getTarget() - meanTarget) * (p.getTarget() - meanTarget);
            sumAbsError += Math.abs(error);
        }

        double r2;
        if (ssTot == 0) {
            r2 = ssRes == 0 ? 1 : 0;
        } else {
            r2 = 1 - ssRes / ssTot;
        }

        RegressionModel model = RegressionModel.builder()
                .coefficients(coefficients)
                .intercept(beta[0])
                .r2Score(r2)
                .mse(ssRes / n)
                .mae(sumAbsError / n)
                .sampleCount(n)
                .modelType(type)
                .polynomialDegree(degree)
                .createdAt(clock.instant())
                .build();
        LOG.debug("Fitted {} regression on {} point(s): r2={} mse={}", type.getKey(), n, r2, model.getMse());
        return model;
    }

    private static double[] unitWeights(int n) {
        double[] w = new double[n];
        Arrays.fill(w, 1);
        return w;
    }

    private static void requireUsable(List<DataPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a regression on zero points");
        }
        int m = points.get(0).dimension();
        for (DataPoint p : points) {
            if (p.dimension() != m) {
                throw new IllegalArgumentException("All data points must have " + m
                        + " features, got " + p.dimension());
            }
        }
    }
}
