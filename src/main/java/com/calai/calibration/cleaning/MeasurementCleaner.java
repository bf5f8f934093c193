package com.calai.calibration.cleaning;

import com.calai.calibration.common.Doubles;
import com.calai.calibration.observation.DailyRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling median / MAD outlier handling for a daily scalar series.
 * <p>
 * DAMP keeps every point but pulls anything beyond k·MAD back toward the median with a tanh clamp,
 * so the deviation never exceeds (k+1)·MAD. DROP turns the same points into NaN.
 * Missing input stays missing.
 */
@Slf4j
public class MeasurementCleaner {

    private final CleanerConfig config;

    public MeasurementCleaner(CleanerConfig config) {
        this.config = config;
    }

    public CleanerConfig config() {
        return config;
    }

    public List<CleanedObservation> clean(List<DailyRecord> records) {
        int n = records.size();
        double[] fat = new double[n];
        double[] lean = new double[n];
        for (int i = 0; i < n; i++) {
            fat[i] = Doubles.orNaN(records.get(i).rawFatMassKg());
            lean[i] = Doubles.orNaN(records.get(i).rawLeanMassKg());
        }

        double[] fatClean = clean(fat);
        double[] leanClean = clean(lean);

        List<CleanedObservation> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new CleanedObservation(records.get(i).date(), fatClean[i], leanClean[i]));
        }
        return out;
    }

    public double[] clean(double[] raw) {
        int n = raw.length;
        double[] med = new double[n];
        double[] mad = new double[n];
        int half = config.window() / 2;

        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n, i - half + config.window());
            double[] slice = new double[to - from];
            System.arraycopy(raw, from, slice, 0, slice.length);
            med[i] = Doubles.median(slice);
            mad[i] = Doubles.mad(slice, med[i]);
        }

        double[] scale = resolveMad(mad);
        double[] out = new double[n];
        int touched = 0;

        for (int i = 0; i < n; i++) {
            double x = raw[i];
            if (Double.isNaN(x)) {
                out[i] = Double.NaN;
                continue;
            }
            double s = Double.isNaN(scale[i]) ? config.minMad() : scale[i];
            double z = (x - med[i]) / s;
            if (Math.abs(z) <= config.k()) {
                out[i] = x;
                continue;
            }
            touched++;
            out[i] = switch (config.mode()) {
                case DAMP -> med[i] + Math.signum(z) * s * (config.k() + Math.tanh(Math.abs(z) - config.k()));
                case DROP -> Double.NaN;
            };
        }

        if (touched > 0) {
            log.debug("cleaner {} touched {} of {} points", config.mode(), touched, n);
        }
        return out;
    }

    /**
     * Replaces zero MADs with the nearest non-zero one (earlier index wins a tie).
     * Falls back to {@code minMad} when the whole series is flat; NaN entries stay NaN.
     */
    double[] resolveMad(double[] mad) {
        int n = mad.length;
        double[] out = mad.clone();
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(mad[i]) || mad[i] > 0) continue;

            double found = Double.NaN;
            for (int d = 1; d < n && Double.isNaN(found); d++) {
                int lo = i - d;
                int hi = i + d;
                if (lo >= 0 && mad[lo] > 0) found = mad[lo];
                else if (hi < n && mad[hi] > 0) found = mad[hi];
                if (lo < 0 && hi >= n) break;
            }
            out[i] = Double.isNaN(found) ? config.minMad() : found;
        }
        return out;
    }
}
