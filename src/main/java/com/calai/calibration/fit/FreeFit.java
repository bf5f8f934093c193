package com.calai.calibration.fit;

/**
 * @param featureNames design columns in fit order, after the variant dropped fixed parameters
 */
public record FreeFit(PhysioParameters parameters, double conditionNumber, String[] featureNames) {
}
