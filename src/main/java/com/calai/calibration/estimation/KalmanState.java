package com.calai.calibration.estimation;

/**
 * Filter accumulator after one day.
 *
 * @param estimate posterior mean x̂
 * @param variance posterior variance P
 * @param gain     Kalman gain applied that day, 0 when nothing was measured
 * @param measured whether a measurement was absorbed that day
 */
public record KalmanState(double estimate, double variance, double gain, boolean measured) {
}
