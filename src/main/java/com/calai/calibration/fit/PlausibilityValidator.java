package com.calai.calibration.fit;

import java.util.List;

public class PlausibilityValidator {

    private final ParameterBounds bounds;

    public PlausibilityValidator(ParameterBounds bounds) {
        this.bounds = bounds;
    }

    public ParameterBounds bounds() {
        return bounds;
    }

    /** @throws ImplausibleParameterException on any violation, α ≤ 0 or non-finite values */
    public PhysioParameters validate(PhysioParameters p) {
        List<String> v = bounds.violations(p);
        if (!v.isEmpty()) throw new ImplausibleParameterException(p, v);
        return p;
    }
}
