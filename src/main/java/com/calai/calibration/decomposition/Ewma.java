package com.calai.calibration.decomposition;

/**
 * Recursive EWMA y = a·x + (1−a)·y' with a = 1 − 0.5^(1/halfLife).
 * Missing inputs carry the previous output forward; output is NaN until the first present input.
 */
public final class Ewma {

    private Ewma() {}

    public static double alpha(double halfLifeDays) {
        if (!(halfLifeDays > 0)) throw new IllegalArgumentException("EWMA_HALF_LIFE_INVALID");
        return 1.0 - Math.pow(0.5, 1.0 / halfLifeDays);
    }

    public static double[] of(double[] x, double halfLifeDays) {
        double a = alpha(halfLifeDays);
        double[] out = new double[x.length];
        double prev = Double.NaN;
        for (int i = 0; i < x.length; i++) {
            double v = x[i];
            if (!Double.isNaN(v)) {
                prev = Double.isNaN(prev) ? v : a * v + (1 - a) * prev;
            }
            out[i] = prev;
        }
        return out;
    }
}
