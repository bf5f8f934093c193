package com.calai.calibration.params;

import com.calai.calibration.common.CalibrationException;

/** The proposal's base version is no longer the active one. */
public class StaleBaseVersionException extends CalibrationException {
    public StaleBaseVersionException(String message) {
        super("STALE_BASE_VERSION", message);
    }
}
