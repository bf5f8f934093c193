package com.calai.calibration.estimation;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StateEstimatorTest {

    private static final LocalDate D0 = LocalDate.of(2025, 3, 1);

    private static List<LocalDate> days(int n) {
        List<LocalDate> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(D0.plusDays(i));
        return out;
    }

    @Test
    void constant_measurement_drives_gain_down_and_variance_non_increasing() {
        StateEstimator est = new StateEstimator(KalmanConfig.defaults());
        double[] z = new double[60];
        Arrays.fill(z, 18.0);

        List<StateEstimate> out = est.filter(days(60), z);

        assertThat(out.get(0).gain()).isEqualTo(0.0);
        assertThat(out.get(0).varianceKg2()).isEqualTo(2.89);
        for (int i = 2; i < out.size(); i++) {
            assertThat(out.get(i).gain()).isLessThanOrEqualTo(out.get(i - 1).gain() + 1e-15);
            assertThat(out.get(i).varianceKg2()).isLessThanOrEqualTo(out.get(i - 1).varianceKg2() + 1e-15);
        }
        for (StateEstimate s : out) {
            assertThat(s.gain()).isBetween(0.0, 1.0);
            assertThat(s.estimatedFatMassKg()).isCloseTo(18.0, within(1e-12));
        }
        // 穩態 gain 約 0.08
        assertThat(out.get(59).gain()).isLessThan(0.1);
    }

    @Test
    void missing_days_only_grow_variance_by_elapsed_process_noise() {
        KalmanConfig cfg = KalmanConfig.defaults();
        StateEstimator est = new StateEstimator(cfg);
        double[] z = {20.0, Double.NaN, Double.NaN, 20.5};

        List<StateEstimate> out = est.filter(days(4), z);

        assertThat(out.get(1).estimatedFatMassKg()).isEqualTo(20.0);
        assertThat(out.get(1).varianceKg2()).isCloseTo(2.89 + cfg.processVariance(), within(1e-12));
        assertThat(out.get(2).varianceKg2()).isCloseTo(2.89 + 2 * cfg.processVariance(), within(1e-12));
        assertThat(out.get(1).gain()).isZero();
        assertThat(out.get(1).measured()).isFalse();
        assertThat(out.get(3).measured()).isTrue();
    }

    @Test
    void gap_in_dates_counts_elapsed_days() {
        KalmanConfig cfg = KalmanConfig.defaults();
        StateEstimator est = new StateEstimator(cfg);

        List<StateEstimate> out = est.filter(List.of(D0, D0.plusDays(5)), new double[]{20.0, 21.0});

        double pPred = 2.89 + 5 * cfg.processVariance();
        double k = pPred / (pPred + 2.89);
        assertThat(out.get(1).gain()).isCloseTo(k, within(1e-12));
        assertThat(out.get(1).estimatedFatMassKg()).isCloseTo(20.0 + k, within(1e-12));
        assertThat(out.get(1).varianceKg2()).isCloseTo((1 - k) * pPred, within(1e-12));
    }

    @Test
    void days_before_first_measurement_have_no_estimate() {
        StateEstimator est = new StateEstimator(KalmanConfig.defaults());

        List<StateEstimate> out = est.filter(days(3), new double[]{Double.NaN, 19.0, 19.2});

        assertThat(out.get(0).estimatedFatMassKg()).isNaN();
        assertThat(out.get(1).estimatedFatMassKg()).isEqualTo(19.0);
        assertThat(out.get(1).varianceKg2()).isEqualTo(2.89);
    }

    @Test
    void no_measurement_at_all_throws() {
        StateEstimator est = new StateEstimator(KalmanConfig.defaults());
        double[] z = new double[5];
        Arrays.fill(z, Double.NaN);

        assertThatThrownBy(() -> est.filter(days(5), z))
                .isInstanceOf(NoMeasurementsException.class)
                .extracting(e -> ((NoMeasurementsException) e).code())
                .isEqualTo("NO_MEASUREMENTS");
    }

    @Test
    void identical_input_gives_identical_output() {
        StateEstimator est = new StateEstimator(KalmanConfig.defaults());
        double[] z = new double[40];
        for (int i = 0; i < z.length; i++) z[i] = 20 + Math.sin(i / 3.0) + (i % 7 == 0 ? Double.NaN : 0);

        List<StateEstimate> a = est.filterAndSmooth(days(40), z);
        List<StateEstimate> b = est.filterAndSmooth(days(40), z.clone());

        assertThat(a).isEqualTo(b);
    }

    @Test
    void smoother_ends_on_filter_and_never_increases_variance() {
        StateEstimator est = new StateEstimator(KalmanConfig.defaults());
        double[] z = new double[30];
        for (int i = 0; i < z.length; i++) z[i] = 20 + 0.05 * i;

        List<StateEstimate> out = est.filterAndSmooth(days(30), z);

        StateEstimate last = out.get(29);
        assertThat(last.smoothedFatMassKg()).isEqualTo(last.estimatedFatMassKg());
        for (StateEstimate s : out) {
            assertThat(s.smoothedVarianceKg2()).isLessThanOrEqualTo(s.varianceKg2() + 1e-12);
        }
        // 上升趨勢下 filter 會落後，smoother 在中段比 filter 更接近真值
        double truth = 20 + 0.05 * 15;
        assertThat(Math.abs(out.get(15).smoothedFatMassKg() - truth))
                .isLessThan(Math.abs(out.get(15).estimatedFatMassKg() - truth));
    }

    @Test
    void step_is_pure() {
        KalmanStep step = new KalmanStep(KalmanConfig.defaults());
        KalmanState s0 = step.step(null, 20.0, 0);

        KalmanState a = step.step(s0, 21.0, 1);
        KalmanState b = step.step(s0, 21.0, 1);

        assertThat(a).isEqualTo(b);
        assertThat(s0.estimate()).isEqualTo(20.0);
        assertThat(step.step(null, null, 1)).isNull();
    }
}
