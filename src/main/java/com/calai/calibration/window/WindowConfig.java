package com.calai.calibration.window;

import java.util.List;

/**
 * @param lengths           candidate lengths, tried shortest first
 * @param lookbackDays      max distance from an endpoint to the measured day that supplies its fat value
 * @param minValidDays      days inside the window that need both fat and lean present, capped at length − 1
 * @param maxDailyRateKg    |Δfat|/days above this is treated as corrupt data
 * @param minEnergyCoverage share of days with intake and workout present
 */
public record WindowConfig(
        WindowMode mode,
        List<Integer> lengths,
        int lookbackDays,
        int minValidDays,
        double maxDailyRateKg,
        double minEnergyCoverage,
        FatSource fatSource
) {
    public WindowConfig {
        if (mode == null) mode = WindowMode.WEEKLY_FLEX;
        if (fatSource == null) fatSource = FatSource.KALMAN_SMOOTHED;
        if (lengths == null || lengths.isEmpty()) throw new IllegalArgumentException("WINDOW_LENGTHS_REQUIRED");
        if (lengths.stream().anyMatch(l -> l == null || l < 1)) throw new IllegalArgumentException("WINDOW_LENGTH_INVALID");
        if (lookbackDays < 0) throw new IllegalArgumentException("WINDOW_LOOKBACK_INVALID");
        lengths = lengths.stream().distinct().sorted().toList();
    }

    /** 上限為 length − 1：minValidDays=10 時，7 天窗要 6 天、14 天窗要 10 天 */
    public int requiredValidDays(int length) {
        return Math.min(minValidDays, length - 1);
    }

    public static WindowConfig defaults() {
        return new WindowConfig(WindowMode.WEEKLY_FLEX, List.of(7, 14, 21, 28), 3, 10, 0.12, 0.9,
                FatSource.KALMAN_SMOOTHED);
    }
}
