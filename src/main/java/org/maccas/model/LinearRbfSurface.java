package org.maccas.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.maccas.core.CrossMatchException;
import org.maccas.spatial.SkyGeometry;

/**
 * Radial-basis-function interpolant with linear kernel {@code phi(r) = r}.
 *
 * <p>Weights solve {@code (Phi - smoothing * I) w = values}, where {@code Phi[i][j]} is the
 * Euclidean distance between nodes i and j in (ra, dec) degrees, with the RA difference taken
 * across the 0/360 wrap. Immutable once fitted.</p>
 */
public final class LinearRbfSurface implements SkySurface {
    private final double[] nodeRa;
    private final double[] nodeDec;
    private final double[] weights;

    private LinearRbfSurface(double[] nodeRa, double[] nodeDec, double[] weights) {
        this.nodeRa = nodeRa;
        this.nodeDec = nodeDec;
        this.weights = weights;
    }

    /**
     * Fits the surface through the given nodes.
     *
     * @throws CrossMatchException with {@code CM_INSUFFICIENT_MODEL_POINTS} below two nodes, or
     *                             {@code CM_MODEL_FIT_FAILED} when the system is singular or inputs are not finite.
     */
    public static LinearRbfSurface fit(double[] ra, double[] dec, double[] values, double smoothing) {
        int n = ra.length;
        if (dec.length != n || values.length != n) {
            throw new IllegalArgumentException("ra, dec and values must have equal length");
        }
        if (n < 2) {
            throw new CrossMatchException(CrossMatchException.REASON_INSUFFICIENT_MODEL_POINTS,
                    "Cannot fit an offset surface through " + n + " point(s); at least 2 are required");
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(ra[i]) || !Double.isFinite(dec[i]) || !Double.isFinite(values[i])) {
                throw new CrossMatchException(CrossMatchException.REASON_MODEL_FIT_FAILED,
                        "Non-finite surface node at index " + i);
            }
        }

        DecompositionSolver solver = factorize(ra, dec, smoothing);
        double[] weights = solver.solve(new ArrayRealVector(values, true)).toArray();
        return new LinearRbfSurface(ra.clone(), dec.clone(), weights);
    }

    /**
     * Leave-one-out predictions at every node for each value column.
     *
     * <p>{@code result[c][i]} equals what a surface fitted with the same smoothing through every
     * node except i would predict at node i for column c. One factorization serves all nodes:
     * with {@code A = Phi - smoothing * I} and {@code w = A^-1 values}, the held-out residual at
     * node i is {@code w[i] / (A^-1)[i][i]}.</p>
     *
     * @throws CrossMatchException with {@code CM_INSUFFICIENT_MODEL_POINTS} below three nodes, or
     *                             {@code CM_MODEL_FIT_FAILED} when the system is singular.
     */
    public static double[][] leaveOneOut(double[] ra, double[] dec, double[][] valueColumns, double smoothing) {
        int n = ra.length;
        if (dec.length != n) {
            throw new IllegalArgumentException("ra and dec must have equal length");
        }
        if (n < 3) {
            throw new CrossMatchException(CrossMatchException.REASON_INSUFFICIENT_MODEL_POINTS,
                    "Leave-one-out needs at least 3 nodes so each held-out fit keeps 2, found " + n);
        }
        DecompositionSolver solver = factorize(ra, dec, smoothing);
        RealMatrix inverse = solver.getInverse();

        double[][] predictions = new double[valueColumns.length][n];
        for (int c = 0; c < valueColumns.length; c++) {
            double[] values = valueColumns[c];
            if (values.length != n) {
                throw new IllegalArgumentException("value column " + c + " has length " + values.length
                        + ", expected " + n);
            }
            double[] weights = inverse.operate(values);
            for (int i = 0; i < n; i++) {
                double diagonal = inverse.getEntry(i, i);
                if (diagonal == 0.0d || !Double.isFinite(diagonal)) {
                    throw new CrossMatchException(CrossMatchException.REASON_MODEL_FIT_FAILED,
                            "Held-out fit at node " + i + " is degenerate");
                }
                predictions[c][i] = values[i] - weights[i] / diagonal;
            }
        }
        return predictions;
    }

    private static DecompositionSolver factorize(double[] ra, double[] dec, double smoothing) {
        int n = ra.length;
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(ra[i]) || !Double.isFinite(dec[i])) {
                throw new CrossMatchException(CrossMatchException.REASON_MODEL_FIT_FAILED,
                        "Non-finite surface node at index " + i);
            }
        }
        double[][] kernel = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double distance = distance(ra[i], dec[i], ra[j], dec[j]);
                kernel[i][j] = distance;
                kernel[j][i] = distance;
            }
            kernel[i][i] -= smoothing;
        }

        DecompositionSolver solver = new LUDecomposition(new Array2DRowRealMatrix(kernel, false)).getSolver();
        if (!solver.isNonSingular()) {
            throw new CrossMatchException(CrossMatchException.REASON_MODEL_FIT_FAILED,
                    "Offset surface system is singular for " + n + " nodes");
        }
        return solver;
    }

    private static double distance(double ra1, double dec1, double ra2, double dec2) {
        return Math.hypot(SkyGeometry.normalizeDeltaRaDegrees(ra1 - ra2), dec1 - dec2);
    }

    @Override
    public double evaluate(double ra, double dec) {
        double sum = 0.0d;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i] * distance(ra, dec, nodeRa[i], nodeDec[i]);
        }
        return sum;
    }

    public int nodeCount() {
        return weights.length;
    }
}
