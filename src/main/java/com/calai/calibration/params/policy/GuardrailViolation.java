package com.calai.calibration.params.policy;

/**
 * A tripped guardrail. Not thrown: the proposal is still written PENDING with these in cap_reason.
 */
public record GuardrailViolation(String code, String message) {

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
