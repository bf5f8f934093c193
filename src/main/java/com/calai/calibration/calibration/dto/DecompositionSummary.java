package com.calai.calibration.calibration.dto;

public record DecompositionSummary(
        int halfLifeDays,
        int lagDays,
        double kH,
        int iterations,
        boolean converged,
        Double meanAbsResidualKg
) {
}
