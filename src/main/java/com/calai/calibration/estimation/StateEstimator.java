package com.calai.calibration.estimation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Forward Kalman pass over an ordered daily series plus an offline RTS smoother.
 */
public class StateEstimator {

    private final KalmanConfig config;
    private final KalmanStep step;

    public StateEstimator(KalmanConfig config) {
        this.config = config;
        this.step = new KalmanStep(config);
    }

    public KalmanConfig config() {
        return config;
    }

    /**
     * @param dates        strictly increasing dates
     * @param measurements same length, NaN for missing
     * @throws NoMeasurementsException when no day carries a measurement
     */
    public List<StateEstimate> filter(List<LocalDate> dates, double[] measurements) {
        if (dates.size() != measurements.length) throw new IllegalArgumentException("SERIES_LENGTH_MISMATCH");

        List<StateEstimate> out = new ArrayList<>(dates.size());
        KalmanState state = null;
        LocalDate lastProcessed = null;

        for (int i = 0; i < dates.size(); i++) {
            LocalDate d = dates.get(i);
            int gap = 0;
            if (lastProcessed != null) {
                gap = (int) ChronoUnit.DAYS.between(lastProcessed, d);
                if (gap <= 0) throw new IllegalArgumentException("SERIES_NOT_INCREASING");
            }

            double z = measurements[i];
            state = step.step(state, Double.isNaN(z) ? null : z, gap);

            if (state == null) {
                out.add(new StateEstimate(d, Double.NaN, Double.NaN, 0.0, false, Double.NaN, Double.NaN));
                continue;
            }
            lastProcessed = d;
            out.add(new StateEstimate(d, state.estimate(), state.variance(), state.gain(), state.measured(),
                    Double.NaN, Double.NaN));
        }

        if (state == null) throw new NoMeasurementsException("series has no fat-mass measurement");
        return out;
    }

    /** filter followed by the backward pass */
    public List<StateEstimate> filterAndSmooth(List<LocalDate> dates, double[] measurements) {
        return smooth(filter(dates, measurements));
    }

    /**
     * Rauch–Tung–Striebel pass for the random walk: C = P/(P+g·Q),
     * x_s = x + C(x_s' − x), P_s = P + C²(P_s' − (P+g·Q)). Non-causal.
     */
    public List<StateEstimate> smooth(List<StateEstimate> filtered) {
        int n = filtered.size();
        List<StateEstimate> out = new ArrayList<>(filtered);

        int last = n - 1;
        while (last >= 0 && Double.isNaN(filtered.get(last).estimatedFatMassKg())) last--;
        if (last < 0) return out;

        StateEstimate tail = filtered.get(last);
        out.set(last, tail.withSmoothed(tail.estimatedFatMassKg(), tail.varianceKg2()));

        for (int t = last - 1; t >= 0; t--) {
            StateEstimate cur = filtered.get(t);
            if (Double.isNaN(cur.estimatedFatMassKg())) break;

            StateEstimate next = out.get(t + 1);
            int gap = (int) ChronoUnit.DAYS.between(cur.date(), next.date());
            double pPred = cur.varianceKg2() + gap * config.processVariance();
            double c = pPred > 0 ? cur.varianceKg2() / pPred : 0.0;

            double xs = cur.estimatedFatMassKg() + c * (next.smoothedFatMassKg() - cur.estimatedFatMassKg());
            double ps = cur.varianceKg2() + c * c * (next.smoothedVarianceKg2() - pPred);
            out.set(t, cur.withSmoothed(xs, ps));
        }
        return out;
    }
}
