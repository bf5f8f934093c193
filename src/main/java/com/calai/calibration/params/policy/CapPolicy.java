package com.calai.calibration.params.policy;

import com.calai.calibration.fit.ParameterBounds;
import com.calai.calibration.fit.PhysioParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits every parameter to ±fraction of the active value. A zero active value uses fraction × bound span as
 * its step. Without an active set the fitted values are only clamped to the bounds.
 */
public record CapPolicy(double fraction, ParameterBounds bounds) {

    public CapPolicy {
        if (!(fraction > 0)) throw new IllegalArgumentException("CAP_FRACTION_INVALID");
        if (bounds == null) bounds = ParameterBounds.defaults();
    }

    public CapResult apply(PhysioParameters fitted, PhysioParameters active) {
        List<String> capped = new ArrayList<>();
        if (active == null) {
            PhysioParameters p = new PhysioParameters(
                    clamp("alpha", fitted.alpha(), bounds.alphaMin(), bounds.alphaMax(), capped),
                    clamp("C", fitted.c(), bounds.cMin(), bounds.cMax(), capped),
                    clamp("BMR0", fitted.bmr0(), bounds.bmr0Min(), bounds.bmr0Max(), capped),
                    clamp("k_LBM", fitted.kLbm(), bounds.kLbmMin(), bounds.kLbmMax(), capped));
            return new CapResult(p, List.copyOf(capped));
        }

        PhysioParameters p = new PhysioParameters(
                cap("alpha", fitted.alpha(), active.alpha(), bounds.alphaMax() - bounds.alphaMin(), capped),
                cap("C", fitted.c(), active.c(), bounds.cMax() - bounds.cMin(), capped),
                cap("BMR0", fitted.bmr0(), active.bmr0(), bounds.bmr0Max() - bounds.bmr0Min(), capped),
                cap("k_LBM", fitted.kLbm(), active.kLbm(), bounds.kLbmMax() - bounds.kLbmMin(), capped));
        return new CapResult(p, List.copyOf(capped));
    }

    private double cap(String name, double fitted, double base, double span, List<String> capped) {
        double step = fraction * (base != 0 ? Math.abs(base) : span);
        double delta = fitted - base;
        if (Math.abs(delta) <= step) return fitted;
        capped.add(name);
        return base + Math.signum(delta) * step;
    }

    private static double clamp(String name, double v, double lo, double hi, List<String> capped) {
        if (v < lo) {
            capped.add(name);
            return lo;
        }
        if (v > hi) {
            capped.add(name);
            return hi;
        }
        return v;
    }
}
