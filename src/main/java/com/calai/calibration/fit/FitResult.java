package com.calai.calibration.fit;

/**
 * @param fallbackReason why the free fit was not used, null for a free fit
 */
public record FitResult(
        PhysioParameters parameters,
        FitMetrics metrics,
        FitSource source,
        FitVariant variant,
        String fallbackReason
) {
}
