package com.calai.calibration.window;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WindowBuilderTest {

    private static final LocalDate SAT = LocalDate.of(2025, 3, 1);

    private static WindowConfig cfg(WindowMode mode, List<Integer> lengths, int minValid) {
        return new WindowConfig(mode, lengths, 3, minValid, 0.12, 0.9, FatSource.KALMAN_SMOOTHED);
    }

    private static List<WindowInput> series(LocalDate from, int n, IntToDoubleFunction fat) {
        List<WindowInput> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double f = fat.applyAsDouble(i);
            out.add(new WindowInput(from.plusDays(i), 2000, 300, f, f, 50));
        }
        return out;
    }

    private static WindowInput with(WindowInput d, double intake, double measuredFat, double lean) {
        return new WindowInput(d.date(), intake, d.workoutKcal(), d.fatEstimateKg(), measuredFat, lean);
    }

    private static void dropLean(List<WindowInput> days, int from, int to) {
        for (int i = from; i <= to; i++) {
            WindowInput d = days.get(i);
            days.set(i, with(d, d.intakeKcal(), d.measuredFatKg(), Double.NaN));
        }
    }

    @Test
    void nine_valid_days_out_of_fourteen_is_not_enough() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.NON_OVERLAPPING, List.of(14), 10));
        List<WindowInput> days = series(SAT, 15, i -> 20.0);
        dropLean(days, 1, 5);

        assertThat(b.build(days)).isEmpty();
    }

    @Test
    void ten_valid_days_out_of_fourteen_is_enough() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.NON_OVERLAPPING, List.of(14), 10));
        List<WindowInput> days = series(SAT, 15, i -> 20.0);
        dropLean(days, 1, 4);

        List<Window> out = b.build(days);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).validDays()).isEqualTo(10);
    }

    @Test
    void shortest_eligible_length_wins() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.NON_OVERLAPPING, List.of(14, 7), 5));

        List<Window> out = b.build(series(SAT, 30, i -> 20.0 - 0.01 * i));

        assertThat(out).hasSize(4);
        assertThat(out).allSatisfy(w -> assertThat(w.lengthDays()).isEqualTo(7));
        assertThat(out).extracting(Window::startDate)
                .containsExactly(SAT, SAT.plusDays(7), SAT.plusDays(14), SAT.plusDays(21));
    }

    @Test
    void falls_through_to_longer_length_when_shorter_cannot_qualify() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.NON_OVERLAPPING, List.of(7, 14), 10));
        List<WindowInput> days = series(SAT, 30, i -> 20.0);
        dropLean(days, 1, 2);

        List<Window> out = b.build(days);

        // 第一週只剩 5 天有效 → 改用 14 天窗，之後回到 7 天
        assertThat(out).extracting(Window::lengthDays).containsExactly(14, 7, 7);
        assertThat(out).extracting(Window::startDate).containsExactly(SAT, SAT.plusDays(14), SAT.plusDays(21));
    }

    @Test
    void week_long_window_needs_six_valid_days_when_min_valid_is_ten() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(7), 10));
        List<WindowInput> sixValid = series(SAT, 8, i -> 20.0);
        dropLean(sixValid, 1, 1);
        List<WindowInput> fiveValid = series(SAT, 8, i -> 20.0);
        dropLean(fiveValid, 1, 2);

        assertThat(b.evaluate(sixValid, 0, 7)).get().extracting(Window::validDays).isEqualTo(6);
        assertThatThrownBy(() -> b.evaluate(fiveValid, 0, 7)).isInstanceOf(DataGapException.class);
    }

    @Test
    void required_valid_days_is_capped_below_window_length() {
        WindowConfig c = WindowConfig.defaults();

        assertThat(c.requiredValidDays(7)).isEqualTo(6);
        assertThat(c.requiredValidDays(14)).isEqualTo(10);
        assertThat(c.requiredValidDays(28)).isEqualTo(10);
    }

    @Test
    void energy_is_summed_over_half_open_interval() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(7), 5));
        List<WindowInput> days = series(SAT, 10, i -> 20.0 - 0.05 * i);
        for (int i = 0; i < days.size(); i++) days.set(i, with(days.get(i), 1000 + i, days.get(i).measuredFatKg(), 50));

        Window w = b.evaluate(days, 0, 7).orElseThrow();

        assertThat(w.startDate()).isEqualTo(SAT);
        assertThat(w.endDate()).isEqualTo(SAT.plusDays(7));
        assertThat(w.intakeSum()).isEqualTo(7021.0);
        assertThat(w.workoutSum()).isEqualTo(2100.0);
        assertThat(w.deltaFatMassKg()).isCloseTo(-0.35, within(1e-12));
        assertThat(w.dailyRateKg()).isCloseTo(-0.05, within(1e-12));
    }

    @Test
    void missing_energy_day_is_filled_with_window_mean() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(14), 10));
        List<WindowInput> days = series(SAT, 15, i -> 20.0);
        days.set(3, with(days.get(3), Double.NaN, 20.0, 50));

        Window w = b.evaluate(days, 0, 14).orElseThrow();

        assertThat(w.intakeSum()).isCloseTo(28000.0, within(1e-9));
        assertThat(w.workoutSum()).isCloseTo(4200.0, within(1e-9));
    }

    @Test
    void energy_coverage_below_threshold_is_a_data_gap() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(14), 10));
        List<WindowInput> days = series(SAT, 15, i -> 20.0);
        days.set(3, with(days.get(3), Double.NaN, 20.0, 50));
        days.set(4, with(days.get(4), Double.NaN, 20.0, 50));

        assertThatThrownBy(() -> b.evaluate(days, 0, 14)).isInstanceOf(DataGapException.class);
    }

    @Test
    void implausible_rate_excludes_window() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(7), 5));
        List<WindowInput> days = series(SAT, 10, i -> 20.0 + 0.2 * i);

        assertThat(b.evaluate(days, 0, 7)).isEqualTo(Optional.empty());
        assertThat(b.build(days)).isEmpty();
    }

    @Test
    void endpoint_uses_latest_measured_day_within_lookback() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(14), 5));
        List<WindowInput> days = series(SAT, 15, i -> 20.0 - 0.01 * i);
        days.set(14, with(days.get(14), 2000, Double.NaN, 50));
        days.set(13, with(days.get(13), 2000, Double.NaN, 50));

        Window w = b.evaluate(days, 0, 14).orElseThrow();

        assertThat(w.endFatKg()).isCloseTo(20.0 - 0.12, within(1e-12));
        assertThat(w.endDate()).isEqualTo(SAT.plusDays(14));
    }

    @Test
    void endpoint_without_measurement_in_lookback_is_a_data_gap() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(14), 5));
        List<WindowInput> days = series(SAT, 15, i -> 20.0);
        for (int i = 11; i <= 14; i++) days.set(i, with(days.get(i), 2000, Double.NaN, 50));

        assertThatThrownBy(() -> b.evaluate(days, 0, 14))
                .isInstanceOf(DataGapException.class)
                .extracting(e -> ((DataGapException) e).code())
                .isEqualTo("DATA_GAP");
    }

    @Test
    void weekly_flex_anchors_on_sundays() {
        LocalDate wed = LocalDate.of(2025, 3, 5);
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.WEEKLY_FLEX, List.of(7), 5));

        List<Window> out = b.build(series(wed, 30, i -> 20.0));

        assertThat(out).extracting(Window::startDate)
                .containsExactly(LocalDate.of(2025, 3, 9), LocalDate.of(2025, 3, 16), LocalDate.of(2025, 3, 23));
        assertThat(out).allSatisfy(w -> assertThat(w.startDate().getDayOfWeek()).isEqualTo(DayOfWeek.SUNDAY));
    }

    @Test
    void sliding_mode_advances_one_day() {
        WindowBuilder b = new WindowBuilder(cfg(WindowMode.SLIDING, List.of(7), 5));

        assertThat(b.build(series(SAT, 10, i -> 20.0))).hasSize(3);
    }

    @Test
    void gaps_in_calendar_are_rejected() {
        WindowBuilder b = new WindowBuilder(WindowConfig.defaults());
        List<WindowInput> days = new ArrayList<>(series(SAT, 5, i -> 20.0));
        days.remove(2);

        assertThatThrownBy(() -> b.build(days))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("WINDOW_INPUT_NOT_CONTIGUOUS");
    }

    @Test
    void lengths_are_sorted_and_deduplicated() {
        WindowConfig c = cfg(WindowMode.SLIDING, List.of(21, 7, 14, 7), 5);

        assertThat(c.lengths()).containsExactly(7, 14, 21);
    }
}
