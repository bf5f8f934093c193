package com.calai.calibration.decomposition;

import java.util.List;

public record DecomposerConfig(
        double fatHalfLifeDays,
        double carbMassPerG,
        List<Integer> halfLifeCandidates,
        List<Integer> lagCandidates,
        int defaultHalfLifeDays,
        int defaultLagDays,
        int minPairsForGrid,
        double huberDelta,
        double kMax,
        int maxIter,
        double tol
) {
    public DecomposerConfig {
        if (!(fatHalfLifeDays > 0)) throw new IllegalArgumentException("DECOMPOSER_FAT_HALF_LIFE_INVALID");
        if (!(kMax >= 0)) throw new IllegalArgumentException("DECOMPOSER_K_MAX_INVALID");
        if (maxIter < 1) throw new IllegalArgumentException("DECOMPOSER_MAX_ITER_INVALID");
        halfLifeCandidates = List.copyOf(halfLifeCandidates);
        lagCandidates = List.copyOf(lagCandidates);
    }

    public static DecomposerConfig defaults() {
        return new DecomposerConfig(90, 0.0035, List.of(1, 2, 3), List.of(0, 1, 2),
                2, 0, 31, 0.8, 1.5, 5, 1e-6);
    }
}
