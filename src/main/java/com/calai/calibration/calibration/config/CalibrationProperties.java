package com.calai.calibration.calibration.config;

import com.calai.calibration.cleaning.CleanMode;
import com.calai.calibration.fit.FeatureSet;
import com.calai.calibration.fit.FixedParameter;
import com.calai.calibration.window.FatSource;
import com.calai.calibration.window.WindowMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * app.calibration.* 。這裡只負責綁定，真正給元件用的是 CalibrationConfig 轉出的不可變 record。
 */
@Data
@ConfigurationProperties(prefix = "app.calibration")
public class CalibrationProperties {

    private Run run = new Run();
    private Cleaner cleaner = new Cleaner();
    private Kalman kalman = new Kalman();
    private Decomposer decomposer = new Decomposer();
    private Window window = new Window();
    private Fit fit = new Fit();
    private Priors priors = new Priors();
    private Cap cap = new Cap();
    private Guardrails guardrails = new Guardrails();
    private Job job = new Job();

    @Data
    public static class Run {
        /** 整個 run 的 wall-clock 上限，超過就不寫任何東西 */
        private Duration budget = Duration.ofSeconds(60);
    }

    @Data
    public static class Cleaner {
        private int window = 7;
        private double k = 3.0;
        private CleanMode mode = CleanMode.DAMP;
        private double minMad = 0.05;
    }

    @Data
    public static class Kalman {
        /** Q：每天的過程變異 (kg²) */
        private double processVariance = 0.0196;
        /** R：量測變異 (kg²) */
        private double measurementVariance = 2.89;
    }

    @Data
    public static class Decomposer {
        private double fatHalfLifeDays = 90;
        private double carbMassPerG = 0.0035;
        private List<Integer> halfLifeCandidates = new ArrayList<>(List.of(1, 2, 3));
        private List<Integer> lagCandidates = new ArrayList<>(List.of(0, 1, 2));
        private int defaultHalfLifeDays = 2;
        private int defaultLagDays = 0;
        private int minPairsForGrid = 31;
        private double huberDelta = 0.8;
        private double maxHydrationCoefficient = 1.5;
        private int maxIter = 5;
        private double tol = 1e-6;
    }

    @Data
    public static class Window {
        private WindowMode mode = WindowMode.WEEKLY_FLEX;
        private List<Integer> lengths = new ArrayList<>(List.of(7, 14, 21, 28));
        private int lookbackDays = 3;
        private int minValidDays = 10;
        private double maxDailyRateKg = 0.12;
        private double minEnergyCoverage = 0.9;
        private FatSource fatSource = FatSource.KALMAN_SMOOTHED;
    }

    @Data
    public static class Fit {
        private FeatureSet featureSet = FeatureSet.FULL;
        private List<FixedParameter> fixed = new ArrayList<>();
        private double huberEpsilon = 1.35;
        private int maxIter = 500;
        private double tol = 1e-8;
        private double conditionThreshold = 1e4;
        private int minWindowsForFreeFit = 10;
        private Bounds bounds = new Bounds();
        private Fallback fallback = new Fallback();
        private Bootstrap bootstrap = new Bootstrap();
    }

    @Data
    public static class Bounds {
        private double alphaMin = 8000;
        private double alphaMax = 10000;
        private double compensationMin = 0.0;
        private double compensationMax = 0.5;
        private double bmr0Min = 200;
        private double bmr0Max = 1000;
        private double lbmSlopeMin = 2;
        private double lbmSlopeMax = 25;
    }

    @Data
    public static class Fallback {
        private double compensationMin = 0.0;
        private double compensationMax = 0.4;
        private double bmr0Min = 400;
        private double bmr0Max = 1200;
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = true;
        private int iterations = 1000;
        private long seed = 42L;
        private Duration budget = Duration.ofSeconds(10);
    }

    /** 沒有任何生效版本時用的先驗 */
    @Data
    public static class Priors {
        private double alpha = 9800;
        private double c = 0.2;
        private double bmr0 = 600;
        private double lbmSlope = 11.5;
    }

    @Data
    public static class Cap {
        private double fraction = 0.03;
    }

    @Data
    public static class Guardrails {
        private double maxBiasKg = 0.2;
        private int minWindows = 2;
        private double maxMaeKg = 1.0;
    }

    @Data
    public static class Job {
        private boolean enabled = false;
        /** 回看天數 */
        private int lookbackDays = 120;
        /** 每月 1 號凌晨跑上個區間 */
        private String cron = "0 30 3 1 * *";
    }
}
