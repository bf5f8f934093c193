package com.calai.calibration.fit;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which columns go into the regression and which parameters are held at their priors.
 */
public record FitVariant(FeatureSet featureSet, Set<FixedParameter> fixed) {

    public FitVariant {
        if (featureSet == null) featureSet = FeatureSet.FULL;
        fixed = (fixed == null || fixed.isEmpty()) ? Set.of() : Set.copyOf(EnumSet.copyOf(fixed));
    }

    public static FitVariant free() {
        return new FitVariant(FeatureSet.FULL, Set.of());
    }

    public static FitVariant fixedAlphaAndKLbm() {
        return new FitVariant(FeatureSet.NO_LBM, EnumSet.of(FixedParameter.ALPHA, FixedParameter.K_LBM));
    }

    public boolean fixesAlpha() {
        return fixed.contains(FixedParameter.ALPHA);
    }

    public boolean fixesKLbm() {
        return featureSet == FeatureSet.NO_LBM || fixed.contains(FixedParameter.K_LBM);
    }

    /** e.g. {@code FULL} or {@code NO_LBM+ALPHA} */
    public String tag() {
        if (fixed.isEmpty()) return featureSet.name();
        return featureSet.name() + "+" + fixed.stream().map(Enum::name).sorted().collect(Collectors.joining("+"));
    }
}
