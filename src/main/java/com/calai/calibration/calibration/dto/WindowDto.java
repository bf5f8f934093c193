package com.calai.calibration.calibration.dto;

import com.calai.calibration.window.Window;

import java.time.LocalDate;

public record WindowDto(
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
    public static WindowDto from(Window w) {
        return new WindowDto(w.startDate(), w.endDate(), w.lengthDays(), w.startFatKg(), w.endFatKg(),
                w.deltaFatMassKg(), w.intakeSum(), w.workoutSum(), w.meanLeanMassKg(), w.validDays());
    }
}
