package com.calai.calibration.fit;

import java.time.Duration;

public record BootstrapConfig(boolean enabled, int iterations, long seed, Duration budget) {

    public static BootstrapConfig defaults() {
        return new BootstrapConfig(true, 1000, 42L, Duration.ofSeconds(10));
    }
}
