package com.calai.calibration.fit;

/**
 * Residuals are observed − predicted Δfat per window, in kg.
 */
public record FitMetrics(double r2, double mae, double rmse, double bias, double conditionNumber, int nWindows) {
}
