package com.calai.calibration.estimation;

import com.calai.calibration.common.CalibrationException;

public class NoMeasurementsException extends CalibrationException {
    public NoMeasurementsException(String message) {
        super("NO_MEASUREMENTS", message);
    }
}
