package com.calai.calibration.params.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReviewRequest(
        @NotBlank @Size(max = 128) String reviewer,
        String notes
) {
}
