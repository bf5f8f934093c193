package com.calai.calibration.fit;

import com.calai.calibration.window.Window;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Window-resampling bootstrap of the free fit under an explicit seed.
 * <p>
 * The loop checks its deadline (own budget or the caller's, whichever is earlier) before every draw and stops
 * early when it passes. It only returns values; nothing is persisted from here.
 */
@Slf4j
public class BootstrapCi {

    private final ParameterEstimator estimator;
    private final BootstrapConfig config;
    private final Clock clock;

    public BootstrapCi(ParameterEstimator estimator, BootstrapConfig config, Clock clock) {
        this.estimator = estimator;
        this.config = config;
        this.clock = clock;
    }

    public BootstrapResult compute(List<Window> windows, PhysioParameters priors, Instant runDeadline) {
        if (!config.enabled() || windows.size() < 2) return BootstrapResult.skipped(config.iterations());

        Instant own = clock.instant().plus(config.budget());
        Instant deadline = (runDeadline != null && runDeadline.isBefore(own)) ? runDeadline : own;

        RandomGenerator rng = new MersenneTwister(config.seed());
        int n = windows.size();
        List<double[]> draws = new ArrayList<>();
        int failed = 0;
        boolean truncated = false;

        for (int it = 0; it < config.iterations(); it++) {
            if (!clock.instant().isBefore(deadline)) {
                truncated = true;
                break;
            }
            List<Window> sample = new ArrayList<>(n);
            for (int i = 0; i < n; i++) sample.add(windows.get(rng.nextInt(n)));

            try {
                PhysioParameters p = estimator.estimate(sample, priors).parameters();
                if (p.isFinite()) {
                    draws.add(new double[]{p.alpha(), p.c(), p.bmr0(), p.kLbm()});
                } else {
                    failed++;
                }
            } catch (IllConditionedFitException e) {
                failed++;
            }
        }

        int completed = draws.size() + failed;
        if (truncated) {
            log.warn("bootstrap stopped early at {} of {} draws", completed, config.iterations());
        }
        if (draws.size() < 2) {
            return new BootstrapResult(config.iterations(), completed, failed, truncated, null, null, null, null);
        }

        return new BootstrapResult(config.iterations(), completed, failed, truncated,
                interval(draws, 0), interval(draws, 1), interval(draws, 2), interval(draws, 3));
    }

    private static ParameterInterval interval(List<double[]> draws, int col) {
        double[] xs = draws.stream().mapToDouble(d -> d[col]).toArray();
        Percentile pct = new Percentile();
        return new ParameterInterval(pct.evaluate(xs, 2.5), pct.evaluate(xs, 97.5));
    }
}
