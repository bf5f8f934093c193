package com.calai.calibration.observation;

import java.time.LocalDate;

/**
 * One day of the consumed record stream. Nullable fields are gaps.
 */
public record DailyRecord(
        LocalDate date,
        Double intakeKcal,
        Double workoutKcal,
        Double carbohydrateG,
        Double rawFatMassKg,
        Double rawLeanMassKg
) {
}
