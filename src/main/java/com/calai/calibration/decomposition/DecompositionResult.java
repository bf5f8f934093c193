package com.calai.calibration.decomposition;

/**
 * @param trend           slow fat-mass trend
 * @param hydration       fitted hydration component k_h·h
 * @param residual        observed − trend − hydration, NaN where observed is missing
 * @param converged       |Δk_h| fell below tolerance before the iteration cap
 */
public record DecompositionResult(
        double[] trend,
        double[] hydration,
        double[] residual,
        int halfLifeDays,
        int lagDays,
        double kH,
        int iterations,
        boolean converged,
        double meanAbsResidual
) {
}
