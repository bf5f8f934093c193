package com.calai.calibration.fit;

/**
 * @param alpha energy density, kcal per kg fat
 * @param c     exercise compensation fraction
 * @param bmr0  BMR intercept, kcal/day
 * @param kLbm  BMR slope on lean mass, kcal/kg/day
 */
public record PhysioParameters(double alpha, double c, double bmr0, double kLbm) {

    public boolean isFinite() {
        return Double.isFinite(alpha) && Double.isFinite(c) && Double.isFinite(bmr0) && Double.isFinite(kLbm);
    }
}
