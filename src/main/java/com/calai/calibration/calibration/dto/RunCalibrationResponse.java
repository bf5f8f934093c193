package com.calai.calibration.calibration.dto;

import com.calai.calibration.params.dto.ProposalDto;

import java.util.List;

public record RunCalibrationResponse(
        ProposalDto proposal,
        List<String> guardrailViolations,
        List<WindowDto> windows,
        DecompositionSummary decomposition,
        BootstrapSummary bootstrap,
        int statesWritten
) {
}
