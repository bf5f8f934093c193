package com.calai.calibration.params.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/** Missing values fall back to the configured priors. */
public record SeedParamsRequest(
        @NotBlank String actor,
        @NotNull LocalDate effectiveStart,
        Double alpha,
        Double c,
        Double bmr0,
        Double kLbm
) {
}
