package com.calai.calibration.params.policy;

import com.calai.calibration.fit.FitMetrics;

import java.util.ArrayList;
import java.util.List;

public record Guardrails(double maxBiasKg, int minWindows, double maxMaeKg) {

    public static Guardrails defaults() {
        return new Guardrails(0.2, 2, 1.0);
    }

    public List<GuardrailViolation> evaluate(FitMetrics m) {
        List<GuardrailViolation> out = new ArrayList<>();
        if (Double.isFinite(m.bias()) && Math.abs(m.bias()) > maxBiasKg) {
            out.add(new GuardrailViolation("BIAS_TOO_LARGE",
                    String.format("|bias| %.3f kg > %.3f kg", Math.abs(m.bias()), maxBiasKg)));
        }
        if (m.nWindows() < minWindows) {
            out.add(new GuardrailViolation("TOO_FEW_WINDOWS",
                    String.format("%d windows < %d", m.nWindows(), minWindows)));
        }
        if (Double.isFinite(m.mae()) && m.mae() > maxMaeKg) {
            out.add(new GuardrailViolation("MAE_TOO_LARGE",
                    String.format("MAE %.3f kg > %.3f kg", m.mae(), maxMaeKg)));
        }
        return out;
    }
}
