package com.calai.calibration.calibration.service;

import com.calai.calibration.calibration.config.CalibrationDefaults;
import com.calai.calibration.calibration.dto.BootstrapSummary;
import com.calai.calibration.calibration.dto.DailyStateDto;
import com.calai.calibration.calibration.dto.DecompositionSummary;
import com.calai.calibration.calibration.dto.RunCalibrationRequest;
import com.calai.calibration.calibration.dto.RunCalibrationResponse;
import com.calai.calibration.calibration.dto.WindowDto;
import com.calai.calibration.calibration.entity.DailyStateEntity;
import com.calai.calibration.calibration.repo.DailyStateRepo;
import com.calai.calibration.cleaning.CleanedObservation;
import com.calai.calibration.cleaning.MeasurementCleaner;
import com.calai.calibration.common.CalibrationException;
import com.calai.calibration.common.Doubles;
import com.calai.calibration.decomposition.DecompositionResult;
import com.calai.calibration.decomposition.FluctuationDecomposer;
import com.calai.calibration.estimation.StateEstimate;
import com.calai.calibration.estimation.StateEstimator;
import com.calai.calibration.fit.AlphaImplied;
import com.calai.calibration.fit.BootstrapCi;
import com.calai.calibration.fit.BootstrapResult;
import com.calai.calibration.fit.FitDiagnostics;
import com.calai.calibration.fit.FitResult;
import com.calai.calibration.fit.ParameterFitter;
import com.calai.calibration.fit.PhysioParameters;
import com.calai.calibration.observation.DailyRecord;
import com.calai.calibration.observation.DailyRecordSource;
import com.calai.calibration.params.dto.ProposalDto;
import com.calai.calibration.params.entity.ParameterProposalEntity;
import com.calai.calibration.params.entity.ParameterSetEntity;
import com.calai.calibration.params.policy.CapPolicy;
import com.calai.calibration.params.policy.CapResult;
import com.calai.calibration.params.policy.GuardrailViolation;
import com.calai.calibration.params.policy.Guardrails;
import com.calai.calibration.params.service.ParameterVersionService;
import com.calai.calibration.params.service.ProposalDraft;
import com.calai.calibration.window.Window;
import com.calai.calibration.window.WindowBuilder;
import com.calai.calibration.window.WindowInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.calai.calibration.common.Doubles.toNullable;

/**
 * One calibration run: load → clean → filter/smooth + decompose → windows → fit/fallback → cap/guardrails →
 * write states and one PENDING proposal.
 * <p>
 * Everything before the budget check is read-only. Any exception after it rolls the whole run back.
 */
@Slf4j
@Service
public class CalibrationRunService {

    private static final int MAX_RANGE_DAYS = 3 * 366;

    private final DailyRecordSource source;
    private final MeasurementCleaner cleaner;
    private final StateEstimator estimator;
    private final FluctuationDecomposer decomposer;
    private final WindowBuilder windowBuilder;
    private final ParameterFitter fitter;
    private final BootstrapCi bootstrap;
    private final CapPolicy capPolicy;
    private final Guardrails guardrails;
    private final ParameterVersionService versions;
    private final DailyStateRepo stateRepo;
    private final CalibrationDefaults defaults;
    private final Clock clock;

    public CalibrationRunService(DailyRecordSource source,
                                 MeasurementCleaner cleaner,
                                 StateEstimator estimator,
                                 FluctuationDecomposer decomposer,
                                 WindowBuilder windowBuilder,
                                 ParameterFitter fitter,
                                 BootstrapCi bootstrap,
                                 CapPolicy capPolicy,
                                 Guardrails guardrails,
                                 ParameterVersionService versions,
                                 DailyStateRepo stateRepo,
                                 CalibrationDefaults defaults,
                                 Clock clock) {
        this.source = source;
        this.cleaner = cleaner;
        this.estimator = estimator;
        this.decomposer = decomposer;
        this.windowBuilder = windowBuilder;
        this.fitter = fitter;
        this.bootstrap = bootstrap;
        this.capPolicy = capPolicy;
        this.guardrails = guardrails;
        this.versions = versions;
        this.stateRepo = stateRepo;
        this.defaults = defaults;
        this.clock = clock;
    }

    @Transactional
    public RunCalibrationResponse run(RunCalibrationRequest req) {
        Instant deadline = clock.instant().plus(defaults.runBudget());
        Long userId = req.userId();
        LocalDate from = req.from();
        LocalDate to = req.to();
        if (from.isAfter(to)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
        if (from.plusDays(MAX_RANGE_DAYS).isBefore(to)) throw new IllegalArgumentException("DATE_RANGE_TOO_LARGE");
        LocalDate asof = req.asof() != null ? req.asof() : to.plusDays(1);

        log.info("calibration START. userId={} from={} to={} asof={}", userId, from, to, asof);

        List<DailyRecord> days = denseCalendar(source.load(userId, from, to), from, to);
        List<LocalDate> dates = days.stream().map(DailyRecord::date).toList();

        // 1) clean
        List<CleanedObservation> cleaned = cleaner.clean(days);
        double[] fat = cleaned.stream().mapToDouble(CleanedObservation::fatMassKg).toArray();

        // 2) state estimate（沒有任何量測會在這裡直接中止，尚未寫入任何東西）
        List<StateEstimate> states = estimator.filterAndSmooth(dates, fat);

        // 3) decomposition
        double[] carbs = days.stream().mapToDouble(d -> Doubles.orNaN(d.carbohydrateG())).toArray();
        DecompositionResult dec = decomposer.decompose(fat, carbs);

        // 4) windows
        List<WindowInput> inputs = windowInputs(days, cleaned, states, dec);
        List<Window> windows = windowBuilder.build(inputs);

        // 5/6) fit + fallback
        Optional<ParameterSetEntity> active = versions.activeAt(userId, asof);
        PhysioParameters activeParams = active.map(ParameterVersionService::toParameters).orElse(null);
        PhysioParameters priors = activeParams != null ? activeParams : defaults.priors();

        FitResult fit = fitter.fit(windows, priors);
        AlphaImplied implied = FitDiagnostics.alphaImplied(windows, fit.parameters());
        BootstrapResult ci = bootstrap.compute(windows, priors, deadline);

        // 7) cap + guardrails
        CapResult capped = capPolicy.apply(fit.parameters(), activeParams);
        List<GuardrailViolation> violations = guardrails.evaluate(fit.metrics());
        if (!violations.isEmpty()) {
            log.warn("guardrails tripped. userId={} violations={}", userId, violations);
        }

        // ★ 寫入前最後檢查 wall-clock
        if (clock.instant().isAfter(deadline)) {
            throw new CalibrationException("RUN_BUDGET_EXCEEDED",
                    "run exceeded " + defaults.runBudget() + " before writing");
        }

        int written = upsertStates(userId, cleaned, states, dec);
        ParameterProposalEntity proposal = versions.createProposal(new ProposalDraft(
                userId, asof, from, to,
                active.map(ParameterSetEntity::getVersionId).orElse(null),
                fit, capped, capPolicy.fraction(), violations, implied, ci));

        log.info("calibration DONE. userId={} proposalId={} source={} windows={} capReason={}",
                userId, proposal.getId(), fit.source(), windows.size(), proposal.getCapReason());

        return new RunCalibrationResponse(
                ProposalDto.from(proposal),
                violations.stream().map(GuardrailViolation::toString).toList(),
                windows.stream().map(WindowDto::from).toList(),
                new DecompositionSummary(dec.halfLifeDays(), dec.lagDays(), dec.kH(), dec.iterations(),
                        dec.converged(), toNullable(dec.meanAbsResidual())),
                new BootstrapSummary(ci.requested(), ci.completed(), ci.failed(), ci.truncated()),
                written
        );
    }

    @Transactional(readOnly = true)
    public List<DailyStateDto> states(Long userId, LocalDate from, LocalDate to) {
        if (from == null || to == null) throw new IllegalArgumentException("DATE_RANGE_REQUIRED");
        if (from.isAfter(to)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
        return stateRepo.findRange(userId, from, to).stream().map(DailyStateDto::from).toList();
    }

    /** one record per calendar day; days the source skipped become all-null records */
    static List<DailyRecord> denseCalendar(List<DailyRecord> records, LocalDate from, LocalDate to) {
        Map<LocalDate, DailyRecord> byDate = new HashMap<>();
        for (DailyRecord r : records) {
            if (r.date().isBefore(from) || r.date().isAfter(to)) continue;
            if (byDate.put(r.date(), r) != null) throw new IllegalArgumentException("DUPLICATE_OBSERVATION_DATE");
        }
        List<DailyRecord> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            DailyRecord r = byDate.get(d);
            out.add(r != null ? r : new DailyRecord(d, null, null, null, null, null));
        }
        return out;
    }

    private List<WindowInput> windowInputs(List<DailyRecord> days, List<CleanedObservation> cleaned,
                                           List<StateEstimate> states, DecompositionResult dec) {
        List<WindowInput> out = new ArrayList<>(days.size());
        for (int i = 0; i < days.size(); i++) {
            DailyRecord d = days.get(i);
            CleanedObservation c = cleaned.get(i);
            StateEstimate s = states.get(i);
            double fatEstimate = switch (windowBuilder.config().fatSource()) {
                case KALMAN_FILTERED -> s.estimatedFatMassKg();
                case KALMAN_SMOOTHED -> s.smoothedFatMassKg();
                case DECOMPOSED_TREND -> dec.trend()[i];
                case CLEANED -> c.fatMassKg();
            };
            out.add(new WindowInput(d.date(), Doubles.orNaN(d.intakeKcal()), Doubles.orNaN(d.workoutKcal()),
                    fatEstimate, c.fatMassKg(), c.leanMassKg()));
        }
        return out;
    }

    private int upsertStates(Long userId, List<CleanedObservation> cleaned, List<StateEstimate> states,
                             DecompositionResult dec) {
        LocalDate from = cleaned.get(0).date();
        LocalDate to = cleaned.get(cleaned.size() - 1).date();
        Map<LocalDate, DailyStateEntity> existing = new HashMap<>();
        for (DailyStateEntity e : stateRepo.findRange(userId, from, to)) existing.put(e.getObsDate(), e);

        List<DailyStateEntity> rows = new ArrayList<>(cleaned.size());
        for (int i = 0; i < cleaned.size(); i++) {
            CleanedObservation c = cleaned.get(i);
            StateEstimate s = states.get(i);
            DailyStateEntity e = existing.get(c.date());
            if (e == null) {
                e = new DailyStateEntity();
                e.setUserId(userId);
                e.setObsDate(c.date());
            }
            e.setCleanedFatKg(toNullable(c.fatMassKg()));
            e.setCleanedLeanKg(toNullable(c.leanMassKg()));
            e.setFilteredFatKg(toNullable(s.estimatedFatMassKg()));
            e.setFilteredVariance(toNullable(s.varianceKg2()));
            e.setKalmanGain(toNullable(s.gain()));
            e.setSmoothedFatKg(toNullable(s.smoothedFatMassKg()));
            e.setSmoothedVariance(toNullable(s.smoothedVarianceKg2()));
            e.setTrendFatKg(toNullable(dec.trend()[i]));
            e.setHydrationKg(toNullable(dec.hydration()[i]));
            rows.add(e);
        }
        stateRepo.saveAll(rows);
        return rows.size();
    }
}
