package com.calai.calibration.fit;

import com.calai.calibration.window.Window;

/**
 * Δfat = [intake − (1−C)·workout − BMR0·days − k_LBM·lean·days] / α
 */
public final class EnergyBalance {

    private EnergyBalance() {}

    public static double netEnergy(Window w, PhysioParameters p) {
        int days = w.lengthDays();
        return w.intakeSum()
                - (1.0 - p.c()) * w.workoutSum()
                - p.bmr0() * days
                - p.kLbm() * w.meanLeanMassKg() * days;
    }

    public static double predictDeltaFat(Window w, PhysioParameters p) {
        return netEnergy(w, p) / p.alpha();
    }
}
