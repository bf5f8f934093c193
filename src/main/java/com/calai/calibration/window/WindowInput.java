package com.calai.calibration.window;

import java.time.LocalDate;

/**
 * One merged day handed to the builder. NaN marks missing values.
 *
 * @param fatEstimateKg fat mass from the configured {@link FatSource}
 * @param measuredFatKg cleaned fat measurement, used for endpoint lookback and valid-day counting
 */
public record WindowInput(
        LocalDate date,
        double intakeKcal,
        double workoutKcal,
        double fatEstimateKg,
        double measuredFatKg,
        double leanMassKg
) {
}
