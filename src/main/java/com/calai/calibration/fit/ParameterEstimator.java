package com.calai.calibration.fit;

import com.calai.calibration.common.regression.HuberFit;
import com.calai.calibration.common.regression.HuberRegressor;
import com.calai.calibration.window.Window;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Robust regression of window aggregates onto the energy-balance parameters.
 * <p>
 * Free variant: Δfat ~ β_d·days + β_l·days·(lean − centre) + β_w·workout_resid + β_i·intake, no intercept.
 * workout_resid is workout minus its through-origin projection on intake (workout = b·intake + resid).
 * Columns are divided by their RMS before the Huber fit and the coefficients are mapped back, giving
 * α = 1/(β_i − b·β_w), C = 1 + α·β_w, k_LBM = −α·β_l, BMR0 = −α·β_d − k_LBM·centre.
 * <p>
 * Fixing k_LBM moves k·lean·days to the intake side and drops the lean column.
 * Fixing α turns the target into α·Δfat − intake + workout and fits C, BMR0 (and k_LBM) directly.
 */
@Slf4j
public class ParameterEstimator {

    private final FitConfig config;
    private final HuberRegressor huber;

    public ParameterEstimator(FitConfig config) {
        this.config = config;
        this.huber = new HuberRegressor(config.huberEpsilon(), config.maxIter(), config.tol());
    }

    public FitConfig config() {
        return config;
    }

    /**
     * @param priors values used for parameters the variant holds fixed
     * @throws IllConditionedFitException when the scaled design is rank-deficient or its condition number
     *                                    exceeds the configured threshold
     */
    public FreeFit estimate(List<Window> windows, PhysioParameters priors) {
        return estimate(windows, priors, config.variant());
    }

    public FreeFit estimate(List<Window> windows, PhysioParameters priors, FitVariant variant) {
        int n = windows.size();
        boolean fixA = variant.fixesAlpha();
        boolean fixK = variant.fixesKLbm();

        double centre = 0;
        for (Window w : windows) centre += w.meanLeanMassKg();
        centre = n > 0 ? centre / n : 0;

        List<String> names = new ArrayList<>();
        names.add("days");
        if (!fixK) names.add("days_lbm_centered");
        names.add(fixA ? "workout" : "workout_resid");
        if (!fixA) names.add("intake");
        int p = names.size();

        double[][] x = new double[n][p];
        double[] y = new double[n];

        // 只有 free-α 才需要把 workout 對 intake 正交化
        double[] energyIn = new double[n];
        double b = 0;
        if (!fixA) {
            double num = 0;
            double den = 0;
            for (int i = 0; i < n; i++) {
                Window w = windows.get(i);
                energyIn[i] = w.intakeSum() - (fixK ? priors.kLbm() * w.meanLeanMassKg() * w.lengthDays() : 0);
                num += w.workoutSum() * energyIn[i];
                den += energyIn[i] * energyIn[i];
            }
            b = den > 0 ? num / den : 0;
        }

        for (int i = 0; i < n; i++) {
            Window w = windows.get(i);
            int d = w.lengthDays();
            int j = 0;
            x[i][j++] = d;
            if (!fixK) x[i][j++] = d * (w.meanLeanMassKg() - centre);
            if (fixA) {
                x[i][j] = w.workoutSum();
                y[i] = priors.alpha() * w.deltaFatMassKg() - w.intakeSum() + w.workoutSum()
                        + (fixK ? priors.kLbm() * w.meanLeanMassKg() * d : 0);
            } else {
                x[i][j++] = w.workoutSum() - b * energyIn[i];
                x[i][j] = energyIn[i];
                y[i] = w.deltaFatMassKg();
            }
        }

        double[] scale = columnRms(x, p);
        double[][] xs = new double[n][p];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) xs[i][j] = x[i][j] / scale[j];
        }

        double cond = conditionNumber(xs, n, p);
        if (!(cond <= config.conditionThreshold())) {
            throw new IllConditionedFitException(cond, config.conditionThreshold());
        }

        HuberFit fit = huber.fit(xs, y);
        double[] beta = new double[p];
        for (int j = 0; j < p; j++) beta[j] = fit.coefficients()[j] / scale[j];

        PhysioParameters params = mapBack(beta, fixA, fixK, b, centre, priors);
        log.debug("free fit variant={} cond={} iterations={} params={}", variant.tag(), cond, fit.iterations(), params);
        return new FreeFit(params, cond, names.toArray(String[]::new));
    }

    private static PhysioParameters mapBack(double[] beta, boolean fixA, boolean fixK, double b, double centre,
                                            PhysioParameters priors) {
        int j = 0;
        double bDays = beta[j++];
        double bLbm = fixK ? 0 : beta[j++];

        if (fixA) {
            double c = beta[j];
            double k = fixK ? priors.kLbm() : -bLbm;
            double bmr0 = -bDays - (fixK ? 0 : k * centre);
            return new PhysioParameters(priors.alpha(), c, bmr0, k);
        }

        double bWork = beta[j++];
        double bIntake = beta[j];
        double alpha = 1.0 / (bIntake - b * bWork);
        double c = 1.0 + alpha * bWork;
        double k = fixK ? priors.kLbm() : -alpha * bLbm;
        double bmr0 = -alpha * bDays - (fixK ? 0 : k * centre);
        return new PhysioParameters(alpha, c, bmr0, k);
    }

    static double[] columnRms(double[][] x, int p) {
        double[] out = new double[p];
        int n = x.length;
        for (int j = 0; j < p; j++) {
            double ss = 0;
            for (double[] row : x) ss += row[j] * row[j];
            double rms = n > 0 ? Math.sqrt(ss / n) : 0;
            out[j] = rms > 0 ? rms : 1.0;
        }
        return out;
    }

    /** +∞ when there are fewer rows than columns or the smallest singular value is zero */
    static double conditionNumber(double[][] x, int n, int p) {
        if (n < p || n == 0) return Double.POSITIVE_INFINITY;
        double[] s = new SingularValueDecomposition(new Array2DRowRealMatrix(x, false)).getSingularValues();
        double min = s[s.length - 1];
        if (!(min > 0)) return Double.POSITIVE_INFINITY;
        return s[0] / min;
    }
}
