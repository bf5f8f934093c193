package com.calai.calibration.common.regression;

/**
 * @param coefficients one per design column, no intercept
 * @param scale        final robust residual scale (MAD / 0.6745)
 * @param iterations   IRLS iterations run
 * @param converged    coefficient change dropped below tolerance
 */
public record HuberFit(double[] coefficients, double scale, int iterations, boolean converged) {
}
