package com.calai.calibration.fit;

import java.util.ArrayList;
import java.util.List;

public record ParameterBounds(
        double alphaMin, double alphaMax,
        double cMin, double cMax,
        double bmr0Min, double bmr0Max,
        double kLbmMin, double kLbmMax
) {
    public static ParameterBounds defaults() {
        return new ParameterBounds(8000, 10000, 0.0, 0.5, 200, 1000, 2, 25);
    }

    /** human-readable violations, empty when plausible */
    public List<String> violations(PhysioParameters p) {
        List<String> out = new ArrayList<>();
        if (!p.isFinite()) {
            out.add("non-finite parameters");
            return out;
        }
        if (p.alpha() <= 0) out.add(String.format("alpha=%.1f <= 0", p.alpha()));
        check(out, "alpha", p.alpha(), alphaMin, alphaMax);
        check(out, "C", p.c(), cMin, cMax);
        check(out, "BMR0", p.bmr0(), bmr0Min, bmr0Max);
        check(out, "k_LBM", p.kLbm(), kLbmMin, kLbmMax);
        return out;
    }

    private static void check(List<String> out, String name, double v, double lo, double hi) {
        if (v < lo || v > hi) out.add(String.format("%s=%.4f outside [%s, %s]", name, v, lo, hi));
    }
}
