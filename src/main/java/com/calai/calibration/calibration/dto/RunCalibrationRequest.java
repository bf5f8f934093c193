package com.calai.calibration.calibration.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * @param asof effective date of the proposal; defaults to the day after {@code to}
 */
public record RunCalibrationRequest(
        @NotNull Long userId,
        @NotNull LocalDate from,
        @NotNull LocalDate to,
        LocalDate asof
) {
}
