package com.calai.calibration.calibration.config;

import com.calai.calibration.cleaning.CleanerConfig;
import com.calai.calibration.cleaning.MeasurementCleaner;
import com.calai.calibration.decomposition.DecomposerConfig;
import com.calai.calibration.decomposition.FluctuationDecomposer;
import com.calai.calibration.estimation.KalmanConfig;
import com.calai.calibration.estimation.StateEstimator;
import com.calai.calibration.fit.BootstrapCi;
import com.calai.calibration.fit.BootstrapConfig;
import com.calai.calibration.fit.FallbackBounds;
import com.calai.calibration.fit.FitConfig;
import com.calai.calibration.fit.FitVariant;
import com.calai.calibration.fit.ParameterBounds;
import com.calai.calibration.fit.ParameterFitter;
import com.calai.calibration.fit.PhysioParameters;
import com.calai.calibration.params.policy.CapPolicy;
import com.calai.calibration.params.policy.Guardrails;
import com.calai.calibration.window.WindowBuilder;
import com.calai.calibration.window.WindowConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;

/**
 * 把 CalibrationProperties 轉成各元件的不可變設定，元件本身不碰 Spring。
 */
@Configuration
@EnableConfigurationProperties(CalibrationProperties.class)
public class CalibrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeasurementCleaner measurementCleaner(CalibrationProperties props) {
        var c = props.getCleaner();
        return new MeasurementCleaner(new CleanerConfig(c.getWindow(), c.getK(), c.getMode(), c.getMinMad()));
    }

    @Bean
    public StateEstimator stateEstimator(CalibrationProperties props) {
        var k = props.getKalman();
        return new StateEstimator(new KalmanConfig(k.getProcessVariance(), k.getMeasurementVariance()));
    }

    @Bean
    public FluctuationDecomposer fluctuationDecomposer(CalibrationProperties props) {
        var d = props.getDecomposer();
        return new FluctuationDecomposer(new DecomposerConfig(
                d.getFatHalfLifeDays(),
                d.getCarbMassPerG(),
                d.getHalfLifeCandidates(),
                d.getLagCandidates(),
                d.getDefaultHalfLifeDays(),
                d.getDefaultLagDays(),
                d.getMinPairsForGrid(),
                d.getHuberDelta(),
                d.getMaxHydrationCoefficient(),
                d.getMaxIter(),
                d.getTol()));
    }

    @Bean
    public WindowBuilder windowBuilder(CalibrationProperties props) {
        var w = props.getWindow();
        return new WindowBuilder(new WindowConfig(w.getMode(), w.getLengths(), w.getLookbackDays(),
                w.getMinValidDays(), w.getMaxDailyRateKg(), w.getMinEnergyCoverage(), w.getFatSource()));
    }

    @Bean
    public FitConfig fitConfig(CalibrationProperties props) {
        var f = props.getFit();
        var b = f.getBounds();
        var fb = f.getFallback();
        var bs = f.getBootstrap();
        FitVariant variant = new FitVariant(f.getFeatureSet(), Set.copyOf(f.getFixed()));
        return new FitConfig(
                variant,
                f.getHuberEpsilon(),
                f.getMaxIter(),
                f.getTol(),
                f.getConditionThreshold(),
                f.getMinWindowsForFreeFit(),
                new ParameterBounds(b.getAlphaMin(), b.getAlphaMax(), b.getCompensationMin(), b.getCompensationMax(),
                        b.getBmr0Min(), b.getBmr0Max(), b.getLbmSlopeMin(), b.getLbmSlopeMax()),
                new FallbackBounds(fb.getCompensationMin(), fb.getCompensationMax(), fb.getBmr0Min(), fb.getBmr0Max()),
                new BootstrapConfig(bs.isEnabled(), bs.getIterations(), bs.getSeed(), bs.getBudget()));
    }

    @Bean
    public ParameterFitter parameterFitter(FitConfig fitConfig) {
        return new ParameterFitter(fitConfig);
    }

    @Bean
    public BootstrapCi bootstrapCi(ParameterFitter fitter, FitConfig fitConfig, Clock clock) {
        return new BootstrapCi(fitter.estimator(), fitConfig.bootstrap(), clock);
    }

    @Bean
    public CapPolicy capPolicy(CalibrationProperties props, FitConfig fitConfig) {
        return new CapPolicy(props.getCap().getFraction(), fitConfig.bounds());
    }

    @Bean
    public Guardrails guardrails(CalibrationProperties props) {
        var g = props.getGuardrails();
        return new Guardrails(g.getMaxBiasKg(), g.getMinWindows(), g.getMaxMaeKg());
    }

    @Bean
    public CalibrationDefaults calibrationDefaults(CalibrationProperties props) {
        var p = props.getPriors();
        return new CalibrationDefaults(new PhysioParameters(p.getAlpha(), p.getC(), p.getBmr0(), p.getLbmSlope()),
                props.getRun().getBudget());
    }
}
