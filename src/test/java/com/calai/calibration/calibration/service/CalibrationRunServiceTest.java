package com.calai.calibration.calibration.service;

import com.calai.calibration.calibration.config.CalibrationDefaults;
import com.calai.calibration.calibration.dto.RunCalibrationRequest;
import com.calai.calibration.calibration.repo.DailyStateRepo;
import com.calai.calibration.cleaning.CleanerConfig;
import com.calai.calibration.cleaning.MeasurementCleaner;
import com.calai.calibration.common.CalibrationException;
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
import com.calai.calibration.observation.DailyRecord;
import com.calai.calibration.observation.DailyRecordSource;
import com.calai.calibration.params.policy.CapPolicy;
import com.calai.calibration.params.policy.Guardrails;
import com.calai.calibration.params.service.ParameterVersionService;
import com.calai.calibration.window.FatSource;
import com.calai.calibration.window.WindowBuilder;
import com.calai.calibration.window.WindowConfig;
import com.calai.calibration.window.WindowMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class CalibrationRunServiceTest {

    private static final LocalDate FROM = LocalDate.of(2025, 3, 1);
    private static final LocalDate TO = FROM.plusDays(28);
    private static final Instant T0 = Instant.parse("2025-04-01T03:30:00Z");
    private static final PhysioParameters PRIORS = new PhysioParameters(9700, 0.2, 1600, 0);

    private DailyRecordSource source;
    private ParameterVersionService versions;
    private DailyStateRepo stateRepo;
    private Clock clock;
    private CalibrationRunService svc;

    @BeforeEach
    void setUp() {
        source = mock(DailyRecordSource.class);
        versions = mock(ParameterVersionService.class);
        stateRepo = mock(DailyStateRepo.class);
        clock = mock(Clock.class);

        ParameterBounds bounds = new ParameterBounds(8000, 10000, 0, 0.5, 200, 2200, 0, 25);
        FitConfig fit = new FitConfig(FitVariant.free(), 1.35, 500, 1e-8, 1e4, 10, bounds,
                new FallbackBounds(0, 0.4, 400, 2200), new BootstrapConfig(false, 10, 42L, Duration.ofSeconds(1)));
        ParameterFitter fitter = new ParameterFitter(fit);

        svc = new CalibrationRunService(
                source,
                new MeasurementCleaner(CleanerConfig.defaults()),
                new StateEstimator(KalmanConfig.defaults()),
                new FluctuationDecomposer(DecomposerConfig.defaults()),
                new WindowBuilder(new WindowConfig(WindowMode.NON_OVERLAPPING, List.of(14), 3, 10, 0.12, 0.9,
                        FatSource.CLEANED)),
                fitter,
                new BootstrapCi(fitter.estimator(), fit.bootstrap(), Clock.systemUTC()),
                new CapPolicy(0.03, bounds),
                Guardrails.defaults(),
                versions,
                stateRepo,
                new CalibrationDefaults(PRIORS, Duration.ofSeconds(60)),
                clock);

        when(versions.activeAt(any(), any())).thenReturn(Optional.empty());
    }

    private static List<DailyRecord> rampWithGap() {
        List<DailyRecord> out = new ArrayList<>();
        double fat = 20.0;
        for (int i = 0; i <= 28; i++) {
            // 第 5 天整天沒資料（source 直接略過）
            if (i != 5) out.add(new DailyRecord(FROM.plusDays(i), 2500.0, 400.0, null, fat, 50.0));
            fat += (2500 - 0.8 * 400 - 1600) / 9700.0;
        }
        return out;
    }

    @Test
    void budget_overrun_before_write_aborts_without_persisting() {
        when(source.load(1L, FROM, TO)).thenReturn(rampWithGap());
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(120));

        assertThatThrownBy(() -> svc.run(new RunCalibrationRequest(1L, FROM, TO, null)))
                .isInstanceOf(CalibrationException.class)
                .extracting(e -> ((CalibrationException) e).code())
                .isEqualTo("RUN_BUDGET_EXCEEDED");

        verify(stateRepo, never()).saveAll(anyList());
        verify(versions, never()).createProposal(any());
    }

    @Test
    void inverted_range_is_rejected_before_loading() {
        when(clock.instant()).thenReturn(T0);

        assertThatThrownBy(() -> svc.run(new RunCalibrationRequest(1L, TO, FROM, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DATE_RANGE_INVALID");
        verifyNoInteractions(source);
    }

    @Test
    void oversized_range_is_rejected() {
        when(clock.instant()).thenReturn(T0);

        assertThatThrownBy(() -> svc.run(new RunCalibrationRequest(1L, FROM, FROM.plusYears(5), null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DATE_RANGE_TOO_LARGE");
    }

    @Test
    void dense_calendar_fills_skipped_days_and_drops_out_of_range() {
        List<DailyRecord> in = new ArrayList<>(rampWithGap());
        in.add(new DailyRecord(TO.plusDays(3), 1.0, 1.0, null, 1.0, 1.0));

        List<DailyRecord> out = CalibrationRunService.denseCalendar(in, FROM, TO);

        assertThat(out).hasSize(29);
        assertThat(out.get(5).date()).isEqualTo(FROM.plusDays(5));
        assertThat(out.get(5).rawFatMassKg()).isNull();
        assertThat(out.get(5).intakeKcal()).isNull();
        assertThat(out.get(28).date()).isEqualTo(TO);
    }

    @Test
    void duplicate_dates_from_source_are_rejected() {
        DailyRecord r = new DailyRecord(FROM, 2000.0, 300.0, null, 20.0, 50.0);

        assertThatThrownBy(() -> CalibrationRunService.denseCalendar(List.of(r, r), FROM, TO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DUPLICATE_OBSERVATION_DATE");
    }
}
