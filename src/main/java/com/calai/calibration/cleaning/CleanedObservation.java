package com.calai.calibration.cleaning;

import java.time.LocalDate;

/** NaN marks a day without a measurement. */
public record CleanedObservation(LocalDate date, double fatMassKg, double leanMassKg) {
}
