package com.calai.calibration.cleaning;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MeasurementCleanerTest {

    private static double[] baseWithSpike() {
        double[] x = new double[21];
        for (int i = 0; i < x.length; i++) x[i] = 20.0 + 0.1 * (i % 3);
        x[10] = 25.0;
        return x;
    }

    @Test
    void damp_bounds_single_spike_and_keeps_other_points() {
        MeasurementCleaner c = new MeasurementCleaner(new CleanerConfig(7, 3.0, CleanMode.DAMP, 0.05));
        double[] raw = baseWithSpike();

        double[] out = c.clean(raw);

        // 窗內 MAD = 0.1 → 最大偏移 (k+1)·MAD = 0.4
        double unspiked = 20.0 + 0.1 * (10 % 3);
        assertThat(Math.abs(out[10] - unspiked)).isLessThanOrEqualTo(0.4 + 0.1 + 1e-9);
        assertThat(out[10]).isLessThan(raw[10]);
        for (int i = 0; i < raw.length; i++) {
            if (i != 10) assertThat(out[i]).isEqualTo(raw[i]);
        }
    }

    @Test
    void drop_marks_missing_exactly_at_spike() {
        MeasurementCleaner c = new MeasurementCleaner(new CleanerConfig(7, 3.0, CleanMode.DROP, 0.05));

        double[] out = c.clean(baseWithSpike());

        for (int i = 0; i < out.length; i++) {
            if (i == 10) assertThat(out[i]).isNaN();
            else assertThat(out[i]).isNotNaN();
        }
    }

    @Test
    void missing_input_stays_missing_and_nothing_is_fabricated() {
        MeasurementCleaner c = new MeasurementCleaner(CleanerConfig.defaults());
        double[] raw = baseWithSpike();
        raw[3] = Double.NaN;
        raw[4] = Double.NaN;

        double[] out = c.clean(raw);

        assertThat(out[3]).isNaN();
        assertThat(out[4]).isNaN();
        assertThat(Arrays.stream(out).filter(Double::isNaN).count()).isEqualTo(2);
    }

    @Test
    void flat_window_uses_nearest_non_zero_mad() {
        MeasurementCleaner c = new MeasurementCleaner(CleanerConfig.defaults());

        double[] resolved = c.resolveMad(new double[]{0, 0, 0.2, 0, Double.NaN, 0.4});

        assertThat(resolved[0]).isEqualTo(0.2);
        assertThat(resolved[1]).isEqualTo(0.2);
        assertThat(resolved[2]).isEqualTo(0.2);
        assertThat(resolved[3]).isEqualTo(0.2);
        assertThat(resolved[4]).isNaN();
        assertThat(resolved[5]).isEqualTo(0.4);
    }

    @Test
    void fully_flat_series_uses_min_mad_and_does_not_divide_by_zero() {
        MeasurementCleaner c = new MeasurementCleaner(new CleanerConfig(7, 3.0, CleanMode.DAMP, 0.05));
        double[] raw = new double[15];
        Arrays.fill(raw, 20.0);
        raw[7] = 21.0;

        double[] out = c.clean(raw);

        assertThat(out).doesNotContain(Double.NaN);
        // 全平 → minMad 0.05，偏移被壓到 ≤ (3+1)·0.05
        assertThat(out[7] - 20.0).isCloseTo(0.2, within(0.0001));
    }
}
