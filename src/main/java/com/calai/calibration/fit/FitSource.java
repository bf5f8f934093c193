package com.calai.calibration.fit;

public enum FitSource {
    FREE,
    FALLBACK
}
