package com.calai.calibration.calibration.dto;

import com.calai.calibration.calibration.entity.DailyStateEntity;

import java.time.LocalDate;

public record DailyStateDto(
        LocalDate date,
        Double cleanedFatKg,
        Double cleanedLeanKg,
        Double filteredFatKg,
        Double filteredVariance,
        Double kalmanGain,
        Double smoothedFatKg,
        Double smoothedVariance,
        Double trendFatKg,
        Double hydrationKg
) {
    public static DailyStateDto from(DailyStateEntity e) {
        return new DailyStateDto(e.getObsDate(), e.getCleanedFatKg(), e.getCleanedLeanKg(), e.getFilteredFatKg(),
                e.getFilteredVariance(), e.getKalmanGain(), e.getSmoothedFatKg(), e.getSmoothedVariance(),
                e.getTrendFatKg(), e.getHydrationKg());
    }
}
