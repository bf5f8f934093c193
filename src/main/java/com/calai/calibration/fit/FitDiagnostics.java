package com.calai.calibration.fit;

import com.calai.calibration.common.Doubles;
import com.calai.calibration.window.Window;

import java.util.ArrayList;
import java.util.List;

/**
 * Residual statistics of a parameter set against windows.
 */
public final class FitDiagnostics {

    /** windows with a smaller fat change carry no usable α signal */
    static final double MIN_DELTA_FOR_IMPLIED_ALPHA_KG = 0.05;

    private FitDiagnostics() {}

    public static FitMetrics metrics(List<Window> windows, PhysioParameters p, double conditionNumber) {
        int n = windows.size();
        if (n == 0) return new FitMetrics(Double.NaN, Double.NaN, Double.NaN, Double.NaN, conditionNumber, 0);

        double[] obs = new double[n];
        double[] res = new double[n];
        for (int i = 0; i < n; i++) {
            obs[i] = windows.get(i).deltaFatMassKg();
            res[i] = obs[i] - EnergyBalance.predictDeltaFat(windows.get(i), p);
        }

        double mean = Doubles.mean(obs);
        double ssRes = 0;
        double ssTot = 0;
        double absSum = 0;
        double sum = 0;
        for (int i = 0; i < n; i++) {
            ssRes += res[i] * res[i];
            ssTot += (obs[i] - mean) * (obs[i] - mean);
            absSum += Math.abs(res[i]);
            sum += res[i];
        }
        double r2 = ssTot > 0 ? 1.0 - ssRes / ssTot : Double.NaN;
        return new FitMetrics(r2, absSum / n, Math.sqrt(ssRes / n), sum / n, conditionNumber, n);
    }

    public static AlphaImplied alphaImplied(List<Window> windows, PhysioParameters p) {
        List<Double> vals = new ArrayList<>();
        for (Window w : windows) {
            if (Math.abs(w.deltaFatMassKg()) < MIN_DELTA_FOR_IMPLIED_ALPHA_KG) continue;
            double a = EnergyBalance.netEnergy(w, p) / w.deltaFatMassKg();
            if (Double.isFinite(a)) vals.add(a);
        }
        if (vals.isEmpty()) return AlphaImplied.empty();

        double[] xs = vals.stream().mapToDouble(Double::doubleValue).toArray();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double x : xs) {
            min = Math.min(min, x);
            max = Math.max(max, x);
        }
        return new AlphaImplied(min, Doubles.median(xs), max, xs.length);
    }
}
