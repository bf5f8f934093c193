package com.calai.calibration.params.dto;

import com.calai.calibration.params.entity.ParameterProposalEntity;

import java.time.Instant;
import java.time.LocalDate;

public record ProposalDto(
        String proposalId,
        Long userId,
        LocalDate asofDate,
        String baseVersion,
        String status,
        String fitSource,
        String fitVariant,
        String fallbackReason,
        Values fitted,
        Values capped,
        double capFraction,
        String capReason,
        Double r2,
        Double maeKg,
        Double rmseKg,
        Double biasKg,
        Double conditionNumber,
        int nWindows,
        Double alphaImpliedMedian,
        String reviewer,
        String notes,
        Instant reviewedAtUtc
) {
    public record Values(double alpha, double c, double bmr0, double kLbm) {}

    public static ProposalDto from(ParameterProposalEntity p) {
        return new ProposalDto(
                p.getId(),
                p.getUserId(),
                p.getAsofDate(),
                p.getBaseVersion(),
                p.getStatus().name(),
                p.getFitSource(),
                p.getFitVariant(),
                p.getFallbackReason(),
                new Values(p.getFitAlpha(), p.getFitC(), p.getFitBmr0(), p.getFitKLbm()),
                new Values(p.getCappedAlpha(), p.getCappedC(), p.getCappedBmr0(), p.getCappedKLbm()),
                p.getCapFraction(),
                p.getCapReason(),
                p.getR2(),
                p.getMaeKg(),
                p.getRmseKg(),
                p.getBiasKg(),
                p.getConditionNumber(),
                p.getNWindows(),
                p.getAlphaImpliedMedian(),
                p.getReviewer(),
                p.getNotes(),
                p.getReviewedAtUtc()
        );
    }
}
