package com.calai.calibration.params.policy;

import com.calai.calibration.fit.PhysioParameters;

import java.util.List;

/** @param cappedFields names of the parameters the cap moved */
public record CapResult(PhysioParameters parameters, List<String> cappedFields) {

    public boolean anyCapped() {
        return !cappedFields.isEmpty();
    }
}
