package com.calai.calibration.common;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * NaN-aware helpers shared by the numeric stages. Missing values are represented as {@link Double#NaN}.
 */
public final class Doubles {

    private Doubles() {}

    public static boolean present(double v) {
        return !Double.isNaN(v);
    }

    public static double[] presentOnly(double[] values) {
        return Arrays.stream(values).filter(Doubles::present).toArray();
    }

    /** median of the non-missing values, NaN when none */
    public static double median(double[] values) {
        double[] xs = presentOnly(values);
        if (xs.length == 0) return Double.NaN;
        return new Median().evaluate(xs);
    }

    /** median absolute deviation around {@code center}, NaN when none */
    public static double mad(double[] values, double center) {
        double[] xs = presentOnly(values);
        if (xs.length == 0 || Double.isNaN(center)) return Double.NaN;
        double[] dev = new double[xs.length];
        for (int i = 0; i < xs.length; i++) dev[i] = Math.abs(xs[i] - center);
        return new Median().evaluate(dev);
    }

    public static double mean(double[] values) {
        double[] xs = presentOnly(values);
        if (xs.length == 0) return Double.NaN;
        double s = 0;
        for (double x : xs) s += x;
        return s / xs.length;
    }

    public static double[] nanArray(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    public static double orNaN(Double v) {
        return v == null ? Double.NaN : v;
    }

    public static Double toNullable(double v) {
        return Double.isNaN(v) || Double.isInfinite(v) ? null : v;
    }
}
