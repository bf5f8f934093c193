package com.calai.calibration.observation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record UpsertObservationsRequest(@NotEmpty List<@Valid ObservationItem> items) {
}
