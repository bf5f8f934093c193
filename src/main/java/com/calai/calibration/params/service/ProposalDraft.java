package com.calai.calibration.params.service;

import com.calai.calibration.fit.AlphaImplied;
import com.calai.calibration.fit.BootstrapResult;
import com.calai.calibration.fit.FitResult;
import com.calai.calibration.params.policy.CapResult;
import com.calai.calibration.params.policy.GuardrailViolation;

import java.time.LocalDate;
import java.util.List;

/** Everything a calibration run hands over to be written as one PENDING proposal. */
public record ProposalDraft(
        Long userId,
        LocalDate asof,
        LocalDate windowFrom,
        LocalDate windowTo,
        String baseVersion,
        FitResult fit,
        CapResult capped,
        double capFraction,
        List<GuardrailViolation> violations,
        AlphaImplied alphaImplied,
        BootstrapResult bootstrap
) {
}
