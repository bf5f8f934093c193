package com.calai.calibration.fit;

/** Per-window α that would close the energy balance given the other three parameters. */
public record AlphaImplied(double min, double median, double max, int count) {

    public static AlphaImplied empty() {
        return new AlphaImplied(Double.NaN, Double.NaN, Double.NaN, 0);
    }
}
