package com.calai.calibration.calibration.dto;

public record BootstrapSummary(int requested, int completed, int failed, boolean truncated) {
}
