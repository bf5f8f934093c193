package com.calai.calibration.params.dto;

import com.calai.calibration.params.entity.ParameterSetEntity;

import java.time.LocalDate;

public record ParameterSetDto(
        String versionId,
        LocalDate effectiveStartDate,
        LocalDate effectiveEndDate,
        double alphaKcalPerKg,
        double compensationC,
        double bmr0KcalPerDay,
        double kLbmKcalPerKgPerDay,
        String fitMetrics,
        String provenance
) {
    public static ParameterSetDto from(ParameterSetEntity s) {
        return new ParameterSetDto(s.getVersionId(), s.getEffectiveStartDate(), s.getEffectiveEndDate(),
                s.getAlphaKcalPerKg(), s.getCompensationC(), s.getBmr0KcalPerDay(), s.getKLbmKcalPerKgPerDay(),
                s.getFitMetrics(), s.getProvenance());
    }
}
