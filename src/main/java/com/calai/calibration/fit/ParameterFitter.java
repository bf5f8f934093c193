package com.calai.calibration.fit;

import com.calai.calibration.common.CalibrationException;
import com.calai.calibration.window.Window;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Free fit → plausibility check → constrained fallback → re-check. A fallback that is still implausible fails
 * closed with {@link ImplausibleParameterException}.
 */
@Slf4j
public class ParameterFitter {

    private final FitConfig config;
    private final ParameterEstimator estimator;
    private final PlausibilityValidator validator;
    private final ConstrainedFallback fallback;

    public ParameterFitter(FitConfig config) {
        this.config = config;
        this.estimator = new ParameterEstimator(config);
        this.validator = new PlausibilityValidator(config.bounds());
        this.fallback = new ConstrainedFallback(config.fallbackBounds(), config.bounds());
    }

    public ParameterEstimator estimator() {
        return estimator;
    }

    public FitResult fit(List<Window> windows, PhysioParameters priors) {
        if (windows.isEmpty()) {
            throw new CalibrationException("NOT_ENOUGH_WINDOWS", "no eligible windows");
        }

        String reason;
        double cond = Double.NaN;

        if (windows.size() < config.minWindowsForFreeFit()) {
            reason = "NOT_ENOUGH_WINDOWS_FOR_FREE_FIT";
        } else {
            try {
                FreeFit free = estimator.estimate(windows, priors);
                cond = free.conditionNumber();
                PhysioParameters ok = validator.validate(free.parameters());
                return new FitResult(ok, FitDiagnostics.metrics(windows, ok, cond), FitSource.FREE,
                        config.variant(), null);
            } catch (IllConditionedFitException e) {
                cond = e.conditionNumber();
                reason = e.code();
                log.info("free fit ill-conditioned, falling back: {}", e.getMessage());
            } catch (ImplausibleParameterException e) {
                reason = e.code();
                log.info("free fit implausible, falling back: {}", e.getMessage());
            }
        }

        PhysioParameters fb = fallback.solve(windows, priors);
        validator.validate(fb);
        return new FitResult(fb, FitDiagnostics.metrics(windows, fb, cond), FitSource.FALLBACK,
                FitVariant.fixedAlphaAndKLbm(), reason);
    }
}
