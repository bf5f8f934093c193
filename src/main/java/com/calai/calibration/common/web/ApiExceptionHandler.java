package com.calai.calibration.common.web;

import com.calai.calibration.common.CalibrationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.DateTimeException;
import java.util.HashMap;
import java.util.Map;

/**
 * 把例外轉成 {code, message, requestId}：
 * - 400：參數 / 日期 / IllegalArgument / Bean Validation
 * - 404：PROPOSAL_NOT_FOUND / PARAMS_NOT_FOUND
 * - 409：STALE_BASE_VERSION / PROPOSAL_ALREADY_REVIEWED / PARAMS_ALREADY_SEEDED
 * - 422：NO_MEASUREMENTS / IMPLAUSIBLE_PARAMETERS / NOT_ENOUGH_WINDOWS
 * - 503：RUN_BUDGET_EXCEEDED
 * - 500：其他
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CalibrationException.class)
    public ResponseEntity<Map<String, Object>> handleCalibration(CalibrationException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex.code());
        if (status.is5xxServerError()) {
            log.warn("calibration failed code={} msg={}", ex.code(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(err(ex.code(), ex.getMessage(), req));
    }

    static HttpStatus statusOf(String code) {
        return switch (code) {
            case "PROPOSAL_NOT_FOUND", "PARAMS_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "STALE_BASE_VERSION",
                 "PROPOSAL_ALREADY_REVIEWED",
                 "PARAMS_ALREADY_SEEDED",
                 "APPROVAL_DATE_INVALID" -> HttpStatus.CONFLICT;
            case "NO_MEASUREMENTS",
                 "IMPLAUSIBLE_PARAMETERS",
                 "NOT_ENOUGH_WINDOWS",
                 "ILL_CONDITIONED_FIT",
                 "DATA_GAP" -> HttpStatus.UNPROCESSABLE_ENTITY;
            case "RUN_BUDGET_EXCEEDED" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    // ===== 400 Bad Request =====

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        String code = (ex instanceof IllegalArgumentException && isCode(ex.getMessage()))
                ? ex.getMessage().trim()
                : "BAD_REQUEST";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err(code, ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", ex.getMessage(), req));
    }

    private static boolean isCode(String s) {
        return s != null && s.trim().matches("[A-Z][A-Z0-9_]+");
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        String rid = RequestTraceFilter.requestId(req);
        if (rid != null) m.put("requestId", rid);
        return m;
    }
}
