package com.calai.calibration.window;

import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aggregates a dense daily series into eligible windows.
 * <p>
 * Tie-break: for one anchor the shortest eligible length wins. Output is ordered by start date.
 */
@Slf4j
public class WindowBuilder {

    private final WindowConfig config;

    public WindowBuilder(WindowConfig config) {
        this.config = config;
    }

    public WindowConfig config() {
        return config;
    }

    /**
     * @param days consecutive calendar days, one entry per day
     */
    public List<Window> build(List<WindowInput> days) {
        requireContiguous(days);
        List<Window> out = new ArrayList<>();
        int n = days.size();
        int dropped = 0;

        int anchor = 0;
        while (anchor < n) {
            if (config.mode() == WindowMode.WEEKLY_FLEX && days.get(anchor).date().getDayOfWeek() != DayOfWeek.SUNDAY) {
                anchor++;
                continue;
            }

            Window chosen = null;
            for (int len : config.lengths()) {
                try {
                    Optional<Window> w = evaluate(days, anchor, len);
                    if (w.isPresent()) {
                        chosen = w.get();
                        break;
                    }
                } catch (DataGapException e) {
                    dropped++;
                    log.debug("window dropped start={} len={} reason={}", days.get(anchor).date(), len, e.getMessage());
                }
            }

            if (chosen != null) out.add(chosen);

            anchor = switch (config.mode()) {
                case NON_OVERLAPPING -> anchor + (chosen != null ? chosen.lengthDays() : config.lengths().get(0));
                case WEEKLY_FLEX -> anchor + 7;
                case SLIDING -> anchor + 1;
            };
        }

        log.info("windows built mode={} eligible={} dropped={}", config.mode(), out.size(), dropped);
        return out;
    }

    /**
     * @return the window when eligible, empty when it runs past the series or fails the rate sanity bound
     * @throws DataGapException when endpoints, valid days or energy coverage are insufficient
     */
    Optional<Window> evaluate(List<WindowInput> days, int start, int len) {
        int end = start + len;
        if (end >= days.size()) return Optional.empty();

        double startFat = endpointFat(days, start);
        double endFat = endpointFat(days, end);
        if (Double.isNaN(startFat) || Double.isNaN(endFat)) {
            throw new DataGapException("no fat estimate within " + config.lookbackDays() + " days of an endpoint");
        }

        int valid = 0;
        int energyDays = 0;
        double intake = 0;
        double workout = 0;
        double leanSum = 0;
        int leanCount = 0;

        for (int i = start; i < end; i++) {
            WindowInput d = days.get(i);
            if (!Double.isNaN(d.measuredFatKg()) && !Double.isNaN(d.leanMassKg())) valid++;
            if (!Double.isNaN(d.leanMassKg())) {
                leanSum += d.leanMassKg();
                leanCount++;
            }
            if (!Double.isNaN(d.intakeKcal()) && !Double.isNaN(d.workoutKcal())) {
                energyDays++;
                intake += d.intakeKcal();
                workout += d.workoutKcal();
            }
        }

        int required = config.requiredValidDays(len);
        if (valid < required) {
            throw new DataGapException("valid days " + valid + " < " + required);
        }
        if (leanCount == 0) {
            throw new DataGapException("no lean mass in window");
        }
        if (energyDays == 0 || energyDays < Math.ceil(config.minEnergyCoverage() * len)) {
            throw new DataGapException("energy coverage " + energyDays + "/" + len);
        }

        // 缺的能量天數用窗內平均補齊
        if (energyDays < len) {
            intake = intake * len / energyDays;
            workout = workout * len / energyDays;
        }

        double delta = endFat - startFat;
        if (Math.abs(delta) / len > config.maxDailyRateKg()) {
            log.warn("window excluded as corrupt start={} len={} rate={} kg/day",
                    days.get(start).date(), len, delta / len);
            return Optional.empty();
        }

        return Optional.of(new Window(
                days.get(start).date(),
                days.get(end).date(),
                len,
                startFat,
                endFat,
                delta,
                intake,
                workout,
                leanSum / leanCount,
                valid
        ));
    }

    /** fat estimate on the latest measured day at or before {@code idx}, within the lookback */
    private double endpointFat(List<WindowInput> days, int idx) {
        for (int i = idx; i >= Math.max(0, idx - config.lookbackDays()); i--) {
            WindowInput d = days.get(i);
            if (!Double.isNaN(d.measuredFatKg()) && !Double.isNaN(d.fatEstimateKg())) return d.fatEstimateKg();
        }
        return Double.NaN;
    }

    private static void requireContiguous(List<WindowInput> days) {
        for (int i = 1; i < days.size(); i++) {
            LocalDate prev = days.get(i - 1).date();
            if (!days.get(i).date().equals(prev.plusDays(1))) {
                throw new IllegalArgumentException("WINDOW_INPUT_NOT_CONTIGUOUS");
            }
        }
    }
}
