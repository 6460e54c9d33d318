package com.traininginsight.core.math;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Small dense linear-algebra helpers on top of Commons Math.
 *
 * <h3>Singularity</h3>
 * <p>
 * Inversion uses LU decomposition with partial pivoting. A pivot whose
 * magnitude falls below {@value #SINGULARITY_THRESHOLD} marks the matrix as
 * singular:
 * </p>
 * <ul>
 * <li>{@link #invertOrIdentity(double[][])} substitutes the identity matrix,
 * which turns a Mahalanobis distance into an independent per-feature
 * distance.</li>
 * <li>{@link #solve(double[][], double[])} falls back to the SVD
 * minimum-norm least-squares solution.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Matrices {

    private static final Logger LOG = LoggerFactory.getLogger(Matrices.class);

    /** Pivot magnitude below which a matrix is treated as singular. */
    public static final double SINGULARITY_THRESHOLD = 1e-10;

    private Matrices() {
        // utility class
    }

    /**
     * Invert a square matrix, or return the identity if it is singular.
     *
     * @param matrix square matrix; must not be {@code null}
     * @return a new inverse (or identity) matrix
     */
    public static double[][] invertOrIdentity(double[][] matrix) {
        RealMatrix m = toSquareMatrix(matrix);
        DecompositionSolver solver = new LUDecomposition(m, SINGULARITY_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            LOG.warn("Singular {}x{} matrix; substituting identity", matrix.length, matrix.length);
            return identity(matrix.length);
        }
        return solver.getInverse().getData();
    }

    /**
     * Solve {@code A x = b}.
     *
     * @param a square coefficient matrix
     * @param b right-hand side, same length as {@code a}
     * @return solution vector
     */
    public static double[] solve(double[][] a, double[] b) {
        RealMatrix m = toSquareMatrix(a);
        Objects.requireNonNull(b, "right-hand side must not be null");
        if (b.length != a.length) {
            throw new IllegalArgumentException("Dimension mismatch: matrix is " + a.length
                    + "x" + a.length + " but vector has " + b.length + " entries");
        }
        ArrayRealVector rhs = new ArrayRealVector(b, true);
        DecompositionSolver lu = new LUDecomposition(m, SINGULARITY_THRESHOLD).getSolver();
        if (lu.isNonSingular()) {
            return lu.solve(rhs).toArray();
        }
        LOG.warn("Singular {}x{} system; using least-squares pseudo-inverse", a.length, a.length);
        return new SingularValueDecomposition(m).getSolver().solve(rhs).toArray();
    }

    public static double[][] identity(int n) {
        return MatrixUtils.createRealIdentityMatrix(n).getData();
    }

    /**
     * @return {@code xᵀ M x}
     */
    public static double quadraticForm(double[] x, double[][] m) {
        double result = 0;
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < x.length; j++) {
                result += x[i] * m[i][j] * x[j];
            }
        }
        return result;
    }

    /**
     * @return {@code M v}
     */
    public static double[] multiply(double[][] m, double[] v) {
        double[] out = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            double sum = 0;
            for (int j = 0; j < v.length; j++) {
                sum += m[i][j] * v[j];
            }
            out[i] = sum;
        }
        return out;
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector length mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i].clone();
        }
        return out;
    }

    private static RealMatrix toSquareMatrix(double[][] matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (matrix.length == 0) {
            throw new IllegalArgumentException("matrix must not be empty");
        }
        for (double[] row : matrix) {
            if (row.length != matrix.length) {
                throw new IllegalArgumentException("matrix must be square, got row of length "
                        + row.length + " in " + matrix.length + "-row matrix");
            }
        }
        return new Array2DRowRealMatrix(matrix, true);
    }
}
