package com.calai.calibration.fit;

import com.calai.calibration.common.CalibrationException;

import java.util.List;

public class ImplausibleParameterException extends CalibrationException {
    private final PhysioParameters parameters;
    private final List<String> violations;

    public ImplausibleParameterException(PhysioParameters parameters, List<String> violations) {
        super("IMPLAUSIBLE_PARAMETERS", String.join("; ", violations));
        this.parameters = parameters;
        this.violations = List.copyOf(violations);
    }

    public PhysioParameters parameters() { return parameters; }
    public List<String> violations() { return violations; }
}
