package com.calai.calibration.window;

import com.calai.calibration.common.CalibrationException;

/** A candidate window lacks enough valid days. The window is dropped and the run continues. */
public class DataGapException extends CalibrationException {
    public DataGapException(String message) {
        super("DATA_GAP", message);
    }
}
