package com.calai.calibration.fit;

/** Box for the constrained re-fit. It is intersected with {@link ParameterBounds} before clipping. */
public record FallbackBounds(double cMin, double cMax, double bmr0Min, double bmr0Max) {

    public static FallbackBounds defaults() {
        return new FallbackBounds(0.0, 0.4, 400, 1200);
    }
}
