package com.calai.calibration.window;

/** Which daily fat-mass series supplies window endpoints. */
public enum FatSource {
    KALMAN_FILTERED,
    KALMAN_SMOOTHED,
    DECOMPOSED_TREND,
    CLEANED
}
