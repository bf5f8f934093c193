package com.calai.calibration.estimation;

/**
 * @param processVariance     Q, kg² per elapsed day
 * @param measurementVariance R, kg²
 */
public record KalmanConfig(double processVariance, double measurementVariance) {

    public KalmanConfig {
        if (!(processVariance >= 0)) throw new IllegalArgumentException("KALMAN_Q_INVALID");
        if (!(measurementVariance > 0)) throw new IllegalArgumentException("KALMAN_R_INVALID");
    }

    public static KalmanConfig defaults() {
        return new KalmanConfig(0.0196, 2.89);
    }
}
