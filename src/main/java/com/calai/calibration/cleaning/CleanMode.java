package com.calai.calibration.cleaning;

public enum CleanMode {
    /** compress outliers toward the rolling median */
    DAMP,
    /** replace outliers with missing */
    DROP
}
