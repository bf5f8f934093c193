package com.calai.calibration.fit;

public record ParameterInterval(double low, double high) {
}
