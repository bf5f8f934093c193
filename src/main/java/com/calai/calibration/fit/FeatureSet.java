package com.calai.calibration.fit;

public enum FeatureSet {
    /** days, days·(lean − centre), workout residual, intake */
    FULL,
    /** no lean-mass column; k_LBM is held at its prior */
    NO_LBM
}
