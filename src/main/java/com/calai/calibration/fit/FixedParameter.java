package com.calai.calibration.fit;

public enum FixedParameter {
    ALPHA,
    K_LBM
}
