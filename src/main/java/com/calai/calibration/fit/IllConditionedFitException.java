package com.calai.calibration.fit;

import com.calai.calibration.common.CalibrationException;

/** Design matrix near-singular. Triggers the constrained fallback. */
public class IllConditionedFitException extends CalibrationException {
    private final double conditionNumber;

    public IllConditionedFitException(double conditionNumber, double threshold) {
        super("ILL_CONDITIONED_FIT", String.format("condition number %.3g > %.3g", conditionNumber, threshold));
        this.conditionNumber = conditionNumber;
    }

    public double conditionNumber() { return conditionNumber; }
}
