package com.calai.calibration.decomposition;

import com.calai.calibration.common.Doubles;
import com.calai.calibration.common.regression.HuberFit;
import com.calai.calibration.common.regression.HuberRegressor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.ArrayList;
import java.util.List;

/**
 * observed = trend + k_h·hydration + noise.
 * <p>
 * hydration is the zero-centred EWMA of lagged carbohydrate mass; trend is a long EWMA of
 * observed − k_h·hydration. k_h is refined by alternating trend re-estimation and a Huber fit of
 * (observed − trend) on hydration, clamped to [0, kMax]. Missing carbohydrate days count as zero intake.
 */
@Slf4j
public class FluctuationDecomposer {

    private final DecomposerConfig config;
    private final HuberRegressor huber;

    public FluctuationDecomposer(DecomposerConfig config) {
        this.config = config;
        this.huber = new HuberRegressor(config.huberDelta(), 50, 1e-9);
    }

    public DecomposerConfig config() {
        return config;
    }

    public DecompositionResult decompose(double[] observed, double[] carbohydrateG) {
        if (observed.length != carbohydrateG.length) throw new IllegalArgumentException("SERIES_LENGTH_MISMATCH");
        int n = observed.length;

        double[] initialTrend = Ewma.of(observed, config.fatHalfLifeDays());
        int[] chosen = chooseHydrationShape(observed, initialTrend, carbohydrateG);
        int hl = chosen[0];
        int lag = chosen[1];
        double[] h = hydrationSignal(carbohydrateG, hl, lag);

        double k = 0.0;
        double[] trend = initialTrend;
        int it = 0;
        boolean converged = false;

        while (it < config.maxIter()) {
            it++;
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) adjusted[i] = observed[i] - k * h[i];
            trend = Ewma.of(adjusted, config.fatHalfLifeDays());

            double next = fitK(observed, trend, h, k);
            double delta = Math.abs(next - k);
            k = next;
            if (delta < config.tol()) {
                converged = true;
                break;
            }
        }

        double[] adjusted = new double[n];
        for (int i = 0; i < n; i++) adjusted[i] = observed[i] - k * h[i];
        trend = Ewma.of(adjusted, config.fatHalfLifeDays());

        double[] hydration = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            hydration[i] = k * h[i];
            residual[i] = observed[i] - trend[i] - hydration[i];
        }
        double[] absRes = new double[n];
        for (int i = 0; i < n; i++) absRes[i] = Math.abs(residual[i]);

        DecompositionResult result = new DecompositionResult(trend, hydration, residual, hl, lag, k, it, converged,
                Doubles.mean(absRes));
        log.debug("decomposition hl={} lag={} k_h={} iterations={} converged={}", hl, lag, k, it, converged);
        return result;
    }

    /** zero-centred EWMA of lagged carbohydrate mass (kg) */
    double[] hydrationSignal(double[] carbohydrateG, int halfLife, int lag) {
        int n = carbohydrateG.length;
        double[] mass = new double[n];
        for (int i = 0; i < n; i++) {
            int src = i - lag;
            double g = src >= 0 ? carbohydrateG[src] : 0.0;
            mass[i] = (Double.isNaN(g) ? 0.0 : g) * config.carbMassPerG();
        }
        double[] e = Ewma.of(mass, halfLife);
        double mean = Doubles.mean(e);
        for (int i = 0; i < n; i++) e[i] -= mean;
        return e;
    }

    /** grid over half-life × lag maximising |corr(h, observed − trend)|; defaults when too few pairs */
    int[] chooseHydrationShape(double[] observed, double[] trend, double[] carbohydrateG) {
        int bestHl = config.defaultHalfLifeDays();
        int bestLag = config.defaultLagDays();
        double bestCorr = -1;

        for (int hl : config.halfLifeCandidates()) {
            for (int lag : config.lagCandidates()) {
                double[] h = hydrationSignal(carbohydrateG, hl, lag);
                List<double[]> pairs = pairs(h, observed, trend);
                if (pairs.size() < config.minPairsForGrid()) continue;

                double[] a = new double[pairs.size()];
                double[] b = new double[pairs.size()];
                for (int i = 0; i < pairs.size(); i++) {
                    a[i] = pairs.get(i)[0];
                    b[i] = pairs.get(i)[1];
                }
                double c = new PearsonsCorrelation().correlation(a, b);
                if (Double.isNaN(c)) continue;
                if (Math.abs(c) > bestCorr) {
                    bestCorr = Math.abs(c);
                    bestHl = hl;
                    bestLag = lag;
                }
            }
        }
        return new int[]{bestHl, bestLag};
    }

    private double fitK(double[] observed, double[] trend, double[] h, double current) {
        List<double[]> pairs = pairs(h, observed, trend);
        if (pairs.size() < 2) return current;

        double[][] x = new double[pairs.size()][1];
        double[] y = new double[pairs.size()];
        double ss = 0;
        for (int i = 0; i < pairs.size(); i++) {
            x[i][0] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
            ss += x[i][0] * x[i][0];
        }
        // 碳水完全沒變化時 h≡0，k_h 無法辨識
        if (ss < 1e-12) return current;

        HuberFit fit = huber.fit(x, y);
        double k = fit.coefficients()[0];
        if (Double.isNaN(k)) return current;
        return Math.max(0.0, Math.min(config.kMax(), k));
    }

    /** (h, observed − trend) where both sides are present */
    private static List<double[]> pairs(double[] h, double[] observed, double[] trend) {
        List<double[]> out = new ArrayList<>();
        for (int i = 0; i < h.length; i++) {
            double r = observed[i] - trend[i];
            if (Double.isNaN(r) || Double.isNaN(h[i])) continue;
            out.add(new double[]{h[i], r});
        }
        return out;
    }
}
