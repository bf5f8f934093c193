package com.calai.calibration.common;

/**
 * 所有校正流程的領域例外都帶一個 UPPER_SNAKE code，由 ApiExceptionHandler 對應成 HTTP 狀態。
 */
public class CalibrationException extends RuntimeException {
    private final String code;

    public CalibrationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public CalibrationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }
}
