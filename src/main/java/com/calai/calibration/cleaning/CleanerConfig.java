package com.calai.calibration.cleaning;

/**
 * @param window centered rolling window length in days
 * @param k      outlier threshold in MADs
 * @param minMad MAD used when the whole series is flat
 */
public record CleanerConfig(int window, double k, CleanMode mode, double minMad) {

    public CleanerConfig {
        if (window < 1) throw new IllegalArgumentException("CLEANER_WINDOW_INVALID");
        if (!(k > 0)) throw new IllegalArgumentException("CLEANER_K_INVALID");
        if (!(minMad > 0)) throw new IllegalArgumentException("CLEANER_MIN_MAD_INVALID");
        if (mode == null) mode = CleanMode.DAMP;
    }

    public static CleanerConfig defaults() {
        return new CleanerConfig(7, 3.0, CleanMode.DAMP, 0.05);
    }
}
