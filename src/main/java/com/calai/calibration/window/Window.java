package com.calai.calibration.window;

import java.time.LocalDate;

/**
 * Half-open interval [startDate, endDate). Energy sums cover the {@code lengthDays} days from startDate;
 * fat change is measured between the two boundary days.
 */
public record Window(
        LocalDate startDate,
        LocalDate endDate,
        int lengthDays,
        double startFatKg,
        double endFatKg,
        double deltaFatMassKg,
        double intakeSum,
        double workoutSum,
        double meanLeanMassKg,
        int validDays
) {
    public double dailyRateKg() {
        return deltaFatMassKg / lengthDays;
    }
}
