package com.calai.calibration.fit;

public record FitConfig(
        FitVariant variant,
        double huberEpsilon,
        int maxIter,
        double tol,
        double conditionThreshold,
        int minWindowsForFreeFit,
        ParameterBounds bounds,
        FallbackBounds fallbackBounds,
        BootstrapConfig bootstrap
) {
    public FitConfig {
        if (variant == null) variant = FitVariant.free();
        if (bounds == null) bounds = ParameterBounds.defaults();
        if (fallbackBounds == null) fallbackBounds = FallbackBounds.defaults();
        if (bootstrap == null) bootstrap = BootstrapConfig.defaults();
    }

    public static FitConfig defaults() {
        return new FitConfig(FitVariant.free(), 1.35, 500, 1e-8, 1e4, 10,
                ParameterBounds.defaults(), FallbackBounds.defaults(), BootstrapConfig.defaults());
    }
}
