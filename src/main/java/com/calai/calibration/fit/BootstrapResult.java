package com.calai.calibration.fit;

/**
 * 95% percentile intervals; null intervals when fewer than two draws succeeded.
 *
 * @param truncated the iteration or time budget stopped the loop early
 */
public record BootstrapResult(
        int requested,
        int completed,
        int failed,
        boolean truncated,
        ParameterInterval alpha,
        ParameterInterval c,
        ParameterInterval bmr0,
        ParameterInterval kLbm
) {
    public static BootstrapResult skipped(int requested) {
        return new BootstrapResult(requested, 0, 0, false, null, null, null, null);
    }
}
