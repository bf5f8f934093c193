package com.calai.calibration.fit;

import com.calai.calibration.window.Window;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.List;

/**
 * Reduced re-fit with α and k_LBM held at their priors:
 * [workout, −days]·[C, BMR0] = α·Δfat − intake + workout + k_LBM·lean·days.
 * <p>
 * Solved as the least-squares point closest to the prior (pseudo-inverse of the RMS-scaled system around the
 * prior), then clipped to the fallback box intersected with the plausibility bounds.
 */
@Slf4j
public class ConstrainedFallback {

    private final FallbackBounds box;
    private final ParameterBounds bounds;

    public ConstrainedFallback(FallbackBounds box, ParameterBounds bounds) {
        this.box = box;
        this.bounds = bounds;
    }

    /**
     * @throws ImplausibleParameterException when the priors for α or k_LBM are unusable
     */
    public PhysioParameters solve(List<Window> windows, PhysioParameters priors) {
        if (!priors.isFinite() || priors.alpha() <= 0) {
            throw new ImplausibleParameterException(priors, List.of("fallback priors unusable: " + priors));
        }

        double alpha = priors.alpha();
        double k = priors.kLbm();
        int n = windows.size();

        double c = priors.c();
        double bmr0 = priors.bmr0();

        if (n > 0) {
            double[][] a = new double[n][2];
            double[] y = new double[n];
            for (int i = 0; i < n; i++) {
                Window w = windows.get(i);
                int d = w.lengthDays();
                a[i][0] = w.workoutSum();
                a[i][1] = -d;
                y[i] = alpha * w.deltaFatMassKg() - w.intakeSum() + w.workoutSum() + k * w.meanLeanMassKg() * d;
            }

            double[] s = ParameterEstimator.columnRms(a, 2);
            RealMatrix scaled = new Array2DRowRealMatrix(n, 2);
            for (int i = 0; i < n; i++) {
                scaled.setEntry(i, 0, a[i][0] / s[0]);
                scaled.setEntry(i, 1, a[i][1] / s[1]);
            }
            RealVector prior = new ArrayRealVector(new double[]{c * s[0], bmr0 * s[1]});
            RealVector rhs = new ArrayRealVector(y).subtract(scaled.operate(prior));
            RealVector step = new SingularValueDecomposition(scaled).getSolver().solve(rhs);
            RealVector sol = prior.add(step);

            c = sol.getEntry(0) / s[0];
            bmr0 = sol.getEntry(1) / s[1];
        }

        double cLo = Math.max(box.cMin(), bounds.cMin());
        double cHi = Math.min(box.cMax(), bounds.cMax());
        double bLo = Math.max(box.bmr0Min(), bounds.bmr0Min());
        double bHi = Math.min(box.bmr0Max(), bounds.bmr0Max());

        PhysioParameters out = new PhysioParameters(alpha, clip(c, cLo, cHi), clip(bmr0, bLo, bHi), k);
        log.info("fallback solved C={} BMR0={} (unclipped C={} BMR0={}) windows={}", out.c(), out.bmr0(), c, bmr0, n);
        return out;
    }

    private static double clip(double v, double lo, double hi) {
        if (Double.isNaN(v)) return v;
        return Math.max(lo, Math.min(hi, v));
    }
}
