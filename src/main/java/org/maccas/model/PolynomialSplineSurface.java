package org.maccas.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.maccas.core.CrossMatchException;
import org.maccas.spatial.RaArc;

/**
 * Least-squares tensor-product spline of order {@code degree} in each axis with no interior knots.
 *
 * <p>Over its bounding box this is a bivariate polynomial, stored in the Bernstein basis on the
 * normalized domain. The RA side of the box is the smallest {@link RaArc} covering the samples, so
 * a calibration field across RA 0 is one box. Evaluation outside the box is clamped to its edge.</p>
 */
public final class PolynomialSplineSurface implements SkySurface {
    private static final double RANK_THRESHOLD = 1.0e-12d;

    private final int degree;
    private final RaArc raArc;
    private final double minDec;
    private final double spanDec;
    private final double[] coefficients;

    private PolynomialSplineSurface(
            int degree, RaArc raArc, double minDec, double spanDec, double[] coefficients) {
        this.degree = degree;
        this.raArc = raArc;
        this.minDec = minDec;
        this.spanDec = spanDec;
        this.coefficients = coefficients;
    }

    /**
     * Minimum sample count for a surface of the given order.
     */
    public static int requiredSamples(int degree) {
        return (degree + 1) * (degree + 1);
    }

    /**
     * Fits the surface to (ra, dec) to value samples.
     *
     * @throws CrossMatchException with {@code CM_INSUFFICIENT_CALIBRATION_SAMPLE} when there are too
     *                             few samples or they span no area, {@code CM_MODEL_FIT_FAILED} when the
     *                             design matrix is rank deficient.
     */
    public static PolynomialSplineSurface fit(double[] ra, double[] dec, double[] values, int degree) {
        int n = ra.length;
        if (dec.length != n || values.length != n) {
            throw new IllegalArgumentException("ra, dec and values must have equal length");
        }
        if (degree < 1) {
            throw new IllegalArgumentException("degree must be >= 1, got " + degree);
        }
        int terms = requiredSamples(degree);
        if (n < terms) {
            throw new CrossMatchException(CrossMatchException.REASON_INSUFFICIENT_CALIBRATION_SAMPLE,
                    "Flux surface of degree " + degree + " needs at least " + terms
                            + " calibration matches, found " + n);
        }

        RaArc raArc = RaArc.covering(ra);
        double minDec = Double.POSITIVE_INFINITY;
        double maxDec = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            minDec = Math.min(minDec, dec[i]);
            maxDec = Math.max(maxDec, dec[i]);
        }
        if (!(raArc.extentDeg() > 0.0d) || !(maxDec > minDec)) {
            throw new CrossMatchException(CrossMatchException.REASON_INSUFFICIENT_CALIBRATION_SAMPLE,
                    "Calibration matches span no area in RA/Dec; cannot fit a flux surface");
        }

        PolynomialSplineSurface shape = new PolynomialSplineSurface(
                degree, raArc, minDec, maxDec - minDec, new double[terms]);
        double[][] design = new double[n][];
        for (int i = 0; i < n; i++) {
            design[i] = shape.basis(ra[i], dec[i]);
        }

        double[] solution;
        try {
            DecompositionSolver solver =
                    new QRDecomposition(new Array2DRowRealMatrix(design, false), RANK_THRESHOLD).getSolver();
            solution = solver.solve(new ArrayRealVector(values, true)).toArray();
        } catch (SingularMatrixException e) {
            throw new CrossMatchException(CrossMatchException.REASON_MODEL_FIT_FAILED,
                    "Flux surface design matrix is rank deficient for " + n + " samples", e);
        }
        return new PolynomialSplineSurface(degree, raArc, minDec, maxDec - minDec, solution);
    }

    @Override
    public double evaluate(double ra, double dec) {
        double[] basis = basis(ra, dec);
        double sum = 0.0d;
        for (int i = 0; i < basis.length; i++) {
            sum += coefficients[i] * basis[i];
        }
        return sum;
    }

    public int degree() {
        return degree;
    }

    private double[] basis(double ra, double dec) {
        double u = clampUnit(raArc.offsetDegrees(ra) / raArc.extentDeg());
        double v = clampUnit((dec - minDec) / spanDec);
        double[] bu = bernstein(u);
        double[] bv = bernstein(v);
        double[] basis = new double[bu.length * bv.length];
        for (int i = 0; i < bu.length; i++) {
            for (int j = 0; j < bv.length; j++) {
                basis[i * bv.length + j] = bu[i] * bv[j];
            }
        }
        return basis;
    }

    private double[] bernstein(double t) {
        double[] values = new double[degree + 1];
        for (int i = 0; i <= degree; i++) {
            values[i] = CombinatoricsUtils.binomialCoefficientDouble(degree, i)
                    * Math.pow(t, i)
                    * Math.pow(1.0d - t, degree - i);
        }
        return values;
    }

    private static double clampUnit(double value) {
        if (value < 0.0d) {
            return 0.0d;
        }
        return Math.min(value, 1.0d);
    }
}
