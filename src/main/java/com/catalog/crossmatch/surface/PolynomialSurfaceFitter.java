package com.catalog.crossmatch.surface;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.error.SurfaceFitException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.List;

/**
 * Least-squares smoothing surface built from the tensor-product polynomial basis
 * {@code x^i * y^j} with {@code 0 <= i, j <= degree}.
 *
 * <p>Coordinates are rescaled to [-1, 1] over the bounding box of the sample points before
 * the basis is built, which keeps the normal equations well conditioned up to degree 5.
 * The fit is not an interpolant: with more points than basis terms, noisy samples are
 * damped.</p>
 */
public class PolynomialSurfaceFitter implements SurfaceFitter {

    public static final int MIN_DEGREE = 1;
    public static final int MAX_DEGREE = 5;

    private static final double SINGULARITY_THRESHOLD = 1e-12;

    private final int degree;

    public PolynomialSurfaceFitter(int degree) {
        if (degree < MIN_DEGREE || degree > MAX_DEGREE) {
            throw new IllegalArgumentException("degree must be between " + MIN_DEGREE + " and " + MAX_DEGREE);
        }
        this.degree = degree;
    }

    public int getDegree() {
        return degree;
    }

    /**
     * Number of basis terms, which is also the fewest points that determine a fit.
     */
    public static int requiredPoints(int degree) {
        return (degree + 1) * (degree + 1);
    }

    @Override
    public int minimumPoints() {
        return requiredPoints(degree);
    }

    @Override
    public String getName() {
        return "polynomial-" + degree;
    }

    @Override
    public SurfaceModel fit(List<SkyPosition> points, double[] values) {
        if (points.size() != values.length) {
            throw new IllegalArgumentException("points and values differ in size");
        }
        int terms = minimumPoints();
        if (points.size() < terms) {
            throw new SurfaceFitException(getName(),
                    "needs at least " + terms + " points, got " + points.size());
        }

        Scaling xs = Scaling.of(points, true);
        Scaling ys = Scaling.of(points, false);
        double[][] design = new double[points.size()][];
        for (int row = 0; row < points.size(); row++) {
            SkyPosition p = points.get(row);
            design[row] = basis(xs.apply(p.ra()), ys.apply(p.dec()), degree);
        }

        RealMatrix a = new Array2DRowRealMatrix(design, false);
        RealVector b = new ArrayRealVector(values, true);
        DecompositionSolver solver = new QRDecomposition(a, SINGULARITY_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            throw new SurfaceFitException(getName(), "design matrix is rank deficient for "
                    + points.size() + " points; positions may be collinear or repeated");
        }
        try {
            double[] coefficients = solver.solve(b).toArray();
            return new Fitted(degree, xs, ys, coefficients);
        } catch (SingularMatrixException e) {
            throw new SurfaceFitException(getName(), "least-squares solve failed", e);
        }
    }

    static double[] basis(double x, double y, int degree) {
        double[] row = new double[(degree + 1) * (degree + 1)];
        double xi = 1.0;
        int k = 0;
        for (int i = 0; i <= degree; i++) {
            double yj = 1.0;
            for (int j = 0; j <= degree; j++) {
                row[k++] = xi * yj;
                yj *= y;
            }
            xi *= x;
        }
        return row;
    }

    /**
     * Affine map of one coordinate onto [-1, 1].
     */
    record Scaling(double center, double halfRange) {

        static Scaling of(List<SkyPosition> points, boolean ra) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (SkyPosition p : points) {
                double v = ra ? p.ra() : p.dec();
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            double half = (max - min) / 2.0;
            return new Scaling((max + min) / 2.0, half > 0.0 ? half : 1.0);
        }

        double apply(double v) {
            return (v - center) / halfRange;
        }
    }

    private record Fitted(int degree, Scaling xs, Scaling ys, double[] coefficients) implements SurfaceModel {

        @Override
        public double evaluate(double ra, double dec) {
            double[] row = basis(xs.apply(ra), ys.apply(dec), degree);
            double sum = 0.0;
            for (int k = 0; k < row.length; k++) {
                sum += row[k] * coefficients[k];
            }
            return sum;
        }

        @Override
        public String getName() {
            return "polynomial-" + degree;
        }
    }
}
