package com.calai.calibration.calibration.config;

import com.calai.calibration.fit.PhysioParameters;

import java.time.Duration;

/**
 * @param priors    used when a subject has no active parameter set
 * @param runBudget wall-clock limit checked before the first write
 */
public record CalibrationDefaults(PhysioParameters priors, Duration runBudget) {
}
