package com.calai.calibration.common.regression;

import com.calai.calibration.common.Doubles;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;

/**
 * Huber M-estimator through the origin, solved by iteratively reweighted least squares.
 * <p>
 * The first iteration is plain least squares (SVD pseudo-inverse, so rank deficiency does not throw).
 * Residuals are scaled by MAD/0.6745; points beyond {@code epsilon} scaled units get weight ε·s/|r|.
 * Iteration stops when the scale collapses to ~0 (exact fit) or coefficients stop moving.
 */
public class HuberRegressor {

    private static final double MAD_TO_SIGMA = 0.6745;
    private static final double SCALE_FLOOR = 1e-12;

    private final double epsilon;
    private final int maxIter;
    private final double tol;

    public HuberRegressor(double epsilon, int maxIter, double tol) {
        if (!(epsilon > 0)) throw new IllegalArgumentException("HUBER_EPSILON_INVALID");
        if (maxIter < 1) throw new IllegalArgumentException("HUBER_MAX_ITER_INVALID");
        this.epsilon = epsilon;
        this.maxIter = maxIter;
        this.tol = tol;
    }

    public HuberFit fit(double[][] x, double[] y) {
        int n = y.length;
        if (n == 0 || x.length != n) throw new IllegalArgumentException("HUBER_SHAPE_MISMATCH");
        int p = x[0].length;

        double[] w = new double[n];
        Arrays.fill(w, 1.0);

        double[] beta = weightedLeastSquares(x, y, w);
        double scale = Double.NaN;
        int it = 1;
        boolean converged = false;

        while (it < maxIter) {
            double[] r = residuals(x, y, beta);
            scale = Doubles.mad(r, Doubles.median(r)) / MAD_TO_SIGMA;
            if (!(scale > SCALE_FLOOR)) {
                converged = true;
                break;
            }

            double cut = epsilon * scale;
            for (int i = 0; i < n; i++) {
                double a = Math.abs(r[i]);
                w[i] = a <= cut ? 1.0 : cut / a;
            }

            double[] next = weightedLeastSquares(x, y, w);
            it++;

            double delta = 0;
            double norm = 0;
            for (int j = 0; j < p; j++) {
                delta = Math.max(delta, Math.abs(next[j] - beta[j]));
                norm = Math.max(norm, Math.abs(next[j]));
            }
            beta = next;
            if (delta <= tol * Math.max(1.0, norm)) {
                converged = true;
                break;
            }
        }

        if (Double.isNaN(scale)) {
            double[] r = residuals(x, y, beta);
            scale = Doubles.mad(r, Doubles.median(r)) / MAD_TO_SIGMA;
        }
        return new HuberFit(beta, scale, it, converged);
    }

    static double[] weightedLeastSquares(double[][] x, double[] y, double[] w) {
        int n = y.length;
        int p = x[0].length;
        RealMatrix a = new Array2DRowRealMatrix(n, p);
        RealVector b = new ArrayRealVector(n);
        for (int i = 0; i < n; i++) {
            double sw = Math.sqrt(w[i]);
            for (int j = 0; j < p; j++) a.setEntry(i, j, sw * x[i][j]);
            b.setEntry(i, sw * y[i]);
        }
        return new SingularValueDecomposition(a).getSolver().solve(b).toArray();
    }

    public static double[] residuals(double[][] x, double[] y, double[] beta) {
        double[] r = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            double fit = 0;
            for (int j = 0; j < beta.length; j++) fit += x[i][j] * beta[j];
            r[i] = y[i] - fit;
        }
        return r;
    }
}
