package com.calai.calibration.observation.dto;

public record UpsertObservationsResponse(Long userId, int inserted, int updated) {
}
