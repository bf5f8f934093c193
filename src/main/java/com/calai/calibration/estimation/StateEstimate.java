package com.calai.calibration.estimation;

import java.time.LocalDate;

/**
 * Filtered (and optionally smoothed) fat-mass estimate for one day. NaN before the first measurement.
 */
public record StateEstimate(
        LocalDate date,
        double estimatedFatMassKg,
        double varianceKg2,
        double gain,
        boolean measured,
        double smoothedFatMassKg,
        double smoothedVarianceKg2
) {
    public StateEstimate withSmoothed(double fat, double variance) {
        return new StateEstimate(date, estimatedFatMassKg, varianceKg2, gain, measured, fat, variance);
    }
}
