package com.calai.calibration.observation.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record ObservationItem(
        @NotNull LocalDate date,
        @DecimalMin("0") Double intakeKcal,
        @DecimalMin("0") Double workoutKcal,
        @DecimalMin("0") Double carbohydrateG,
        @DecimalMin("0") Double rawFatMassKg,
        @DecimalMin("0") Double rawLeanMassKg
) {
}
