package com.catalog.crossmatch.surface;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.error.SurfaceFitException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.List;

/**
 * Radial-basis surface with the linear kernel {@code phi(r) = r}.
 *
 * <p>Weights solve {@code (Phi - smoothing * I) w = values} where {@code Phi[i][j]} is the
 * planar distance between sample points i and j in degrees. With zero smoothing the surface
 * passes through every sample; a small positive smoothing relaxes it and keeps the system
 * solvable when two samples coincide.</p>
 */
public class RadialBasisFitter implements SurfaceFitter {

    private final double smoothing;

    public RadialBasisFitter(double smoothing) {
        if (smoothing < 0.0 || !Double.isFinite(smoothing)) {
            throw new IllegalArgumentException("smoothing must be finite and >= 0");
        }
        this.smoothing = smoothing;
    }

    @Override
    public int minimumPoints() {
        return 2;
    }

    @Override
    public String getName() {
        return "rbf-linear";
    }

    @Override
    public SurfaceModel fit(List<SkyPosition> points, double[] values) {
        int n = points.size();
        if (n != values.length) {
            throw new IllegalArgumentException("points and values differ in size");
        }
        if (n < minimumPoints()) {
            throw new SurfaceFitException(getName(), "needs at least " + minimumPoints() + " points, got " + n);
        }
        double[] ras = new double[n];
        double[] decs = new double[n];
        for (int i = 0; i < n; i++) {
            ras[i] = points.get(i).ra();
            decs[i] = points.get(i).dec();
        }

        RealMatrix phi = new Array2DRowRealMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double r = Math.hypot(ras[i] - ras[j], decs[i] - decs[j]);
                phi.setEntry(i, j, r);
                phi.setEntry(j, i, r);
            }
            phi.addToEntry(i, i, -smoothing);
        }

        DecompositionSolver solver = new LUDecomposition(phi).getSolver();
        if (!solver.isNonSingular()) {
            throw new SurfaceFitException(getName(),
                    "kernel matrix is singular for " + n + " points; repeated positions need smoothing > 0");
        }
        try {
            double[] weights = solver.solve(new ArrayRealVector(values, true)).toArray();
            return new Fitted(ras, decs, weights);
        } catch (SingularMatrixException e) {
            throw new SurfaceFitException(getName(), "kernel solve failed", e);
        }
    }

    private record Fitted(double[] ras, double[] decs, double[] weights) implements SurfaceModel {

        @Override
        public double evaluate(double ra, double dec) {
            double sum = 0.0;
            for (int i = 0; i < weights.length; i++) {
                sum += weights[i] * Math.hypot(ra - ras[i], dec - decs[i]);
            }
            return sum;
        }

        @Override
        public String getName() {
            return "rbf-linear";
        }
    }
}
