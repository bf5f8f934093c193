package com.calai.calibration.params.service;

import com.calai.calibration.common.CalibrationException;
import com.calai.calibration.fit.BootstrapResult;
import com.calai.calibration.fit.FitMetrics;
import com.calai.calibration.fit.PhysioParameters;
import com.calai.calibration.params.StaleBaseVersionException;
import com.calai.calibration.params.entity.AuditLogEntity;
import com.calai.calibration.params.entity.ParameterProposalEntity;
import com.calai.calibration.params.entity.ParameterSetEntity;
import com.calai.calibration.params.entity.ProposalStatus;
import com.calai.calibration.params.policy.CapResult;
import com.calai.calibration.params.policy.GuardrailViolation;
import com.calai.calibration.params.repo.AuditLogRepo;
import com.calai.calibration.params.repo.ParameterProposalRepo;
import com.calai.calibration.params.repo.ParameterSetRepo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.calai.calibration.common.Doubles.toNullable;

/**
 * Versioned parameter store plus the human-gated proposal workflow.
 * <p>
 * PENDING → APPROVED | REJECTED, exactly once. Approval closes the base version with a conditional update and
 * fails with STALE_BASE_VERSION when another approval got there first.
 */
@Slf4j
@Service
public class ParameterVersionService {

    private static final DateTimeFormatter VERSION_FMT = DateTimeFormatter.ofPattern("'v'yyyy_MM_dd");

    private final ParameterSetRepo setRepo;
    private final ParameterProposalRepo proposalRepo;
    private final AuditLogRepo auditRepo;
    private final ObjectMapper om;
    private final Clock clock;

    public ParameterVersionService(ParameterSetRepo setRepo,
                                   ParameterProposalRepo proposalRepo,
                                   AuditLogRepo auditRepo,
                                   ObjectMapper om,
                                   Clock clock) {
        this.setRepo = setRepo;
        this.proposalRepo = proposalRepo;
        this.auditRepo = auditRepo;
        this.om = om;
        this.clock = clock;
    }

    // ===== read =====

    @Transactional(readOnly = true)
    public Optional<ParameterSetEntity> activeAt(Long userId, LocalDate asof) {
        List<ParameterSetEntity> hits = setRepo.findActiveAt(userId, asof);
        if (hits.size() > 1) {
            log.warn("more than one active parameter set. userId={} asof={} count={}", userId, asof, hits.size());
        }
        return hits.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public ParameterSetEntity requireActive(Long userId, LocalDate asof) {
        return activeAt(userId, asof).orElseThrow(() ->
                new CalibrationException("PARAMS_NOT_FOUND", "no active parameter set on " + asof));
    }

    @Transactional(readOnly = true)
    public ParameterProposalEntity requireProposal(String proposalId) {
        return proposalRepo.findById(proposalId).orElseThrow(() ->
                new CalibrationException("PROPOSAL_NOT_FOUND", "proposal " + proposalId + " not found"));
    }

    @Transactional(readOnly = true)
    public List<ParameterProposalEntity> proposals(Long userId, ProposalStatus status) {
        return status == null
                ? proposalRepo.findByUserIdOrderByCreatedAtUtcDesc(userId)
                : proposalRepo.findByUserIdAndStatusOrderByCreatedAtUtcDesc(userId, status);
    }

    public static PhysioParameters toParameters(ParameterSetEntity s) {
        return new PhysioParameters(s.getAlphaKcalPerKg(), s.getCompensationC(), s.getBmr0KcalPerDay(),
                s.getKLbmKcalPerKgPerDay());
    }

    // ===== write =====

    /** 第一次建立版本（沒有任何 open 版本時才允許） */
    @Transactional
    public ParameterSetEntity seedInitial(Long userId, PhysioParameters params, LocalDate effectiveStart, String actor) {
        if (setRepo.findOpen(userId).isPresent()) {
            throw new CalibrationException("PARAMS_ALREADY_SEEDED", "user " + userId + " already has an active set");
        }
        ParameterSetEntity s = newSet(userId, params, effectiveStart, null, "seed: configured priors");
        setRepo.save(s);
        audit(userId, AuditLogEntity.Action.CHANGE_PARAMS, actor, "initial seed", null, s.getVersionId(), null);
        log.info("parameter set seeded. userId={} version={}", userId, s.getVersionId());
        return s;
    }

    @Transactional
    public ParameterProposalEntity createProposal(ProposalDraft d) {
        ParameterProposalEntity p = new ParameterProposalEntity();
        p.setUserId(d.userId());
        p.setAsofDate(d.asof());
        p.setWindowFrom(d.windowFrom());
        p.setWindowTo(d.windowTo());
        p.setBaseVersion(d.baseVersion());
        p.setFitSource(d.fit().source().name());
        p.setFitVariant(d.fit().variant().tag());
        p.setFallbackReason(d.fit().fallbackReason());

        PhysioParameters f = d.fit().parameters();
        p.setFitAlpha(f.alpha());
        p.setFitC(f.c());
        p.setFitBmr0(f.bmr0());
        p.setFitKLbm(f.kLbm());

        CapResult cap = d.capped();
        p.setCapFraction(d.capFraction());
        p.setCappedAlpha(cap.parameters().alpha());
        p.setCappedC(cap.parameters().c());
        p.setCappedBmr0(cap.parameters().bmr0());
        p.setCappedKLbm(cap.parameters().kLbm());
        p.setCapReason(capReason(cap, d.violations()));

        FitMetrics m = d.fit().metrics();
        p.setR2(toNullable(m.r2()));
        p.setMaeKg(toNullable(m.mae()));
        p.setRmseKg(toNullable(m.rmse()));
        p.setBiasKg(toNullable(m.bias()));
        p.setConditionNumber(toNullable(m.conditionNumber()));
        p.setNWindows(m.nWindows());

        if (d.alphaImplied() != null) {
            p.setAlphaImpliedMin(toNullable(d.alphaImplied().min()));
            p.setAlphaImpliedMedian(toNullable(d.alphaImplied().median()));
            p.setAlphaImpliedMax(toNullable(d.alphaImplied().max()));
        }

        BootstrapResult b = d.bootstrap();
        if (b != null && b.alpha() != null) {
            p.setCiAlphaLow(toNullable(b.alpha().low()));
            p.setCiAlphaHigh(toNullable(b.alpha().high()));
            p.setCiCLow(toNullable(b.c().low()));
            p.setCiCHigh(toNullable(b.c().high()));
            p.setCiBmr0Low(toNullable(b.bmr0().low()));
            p.setCiBmr0High(toNullable(b.bmr0().high()));
            p.setCiKLbmLow(toNullable(b.kLbm().low()));
            p.setCiKLbmHigh(toNullable(b.kLbm().high()));
            p.setBootstrapDraws(b.completed());
        }

        p.setStatus(ProposalStatus.PENDING);
        proposalRepo.save(p);
        log.info("proposal written. userId={} proposalId={} base={} source={} capReason={}",
                d.userId(), p.getId(), d.baseVersion(), p.getFitSource(), p.getCapReason());
        return p;
    }

    /**
     * Promotes the capped values of a PENDING proposal into a new parameter set effective from its as-of date.
     *
     * @throws StaleBaseVersionException when the base version is no longer the open one
     */
    @Transactional
    public ParameterSetEntity approve(String proposalId, String reviewer, String notes) {
        requireReviewer(reviewer);
        ParameterProposalEntity p = requireProposal(proposalId);
        if (!p.isPending()) {
            throw new CalibrationException("PROPOSAL_ALREADY_REVIEWED", "proposal is " + p.getStatus());
        }

        Long userId = p.getUserId();
        LocalDate asof = p.getAsofDate();
        String base = p.getBaseVersion();

        if (base == null) {
            if (setRepo.findOpen(userId).isPresent()) {
                throw new StaleBaseVersionException("proposal has no base but an active set now exists");
            }
        } else {
            ParameterSetEntity baseSet = setRepo.findByUserIdAndVersionId(userId, base)
                    .orElseThrow(() -> new StaleBaseVersionException("base version " + base + " missing"));
            if (!baseSet.getEffectiveStartDate().isBefore(asof)) {
                throw new CalibrationException("APPROVAL_DATE_INVALID",
                        "as-of " + asof + " is not after base start " + baseSet.getEffectiveStartDate());
            }
            // ✅ 樂觀併發：只有 base 仍是 open 版本才關得掉
            int closed = setRepo.closeIfOpen(userId, base, asof.minusDays(1));
            if (closed == 0) {
                throw new StaleBaseVersionException("base version " + base + " is no longer active");
            }
        }

        int moved = proposalRepo.transitionFromPending(proposalId, ProposalStatus.APPROVED, reviewer, notes,
                Instant.now(clock));
        if (moved == 0) {
            throw new CalibrationException("PROPOSAL_ALREADY_REVIEWED", "proposal " + proposalId + " already reviewed");
        }

        PhysioParameters capped = new PhysioParameters(p.getCappedAlpha(), p.getCappedC(), p.getCappedBmr0(),
                p.getCappedKLbm());
        String provenance = "proposal " + proposalId + " (" + p.getFitSource() + ", " + p.getFitVariant() + ")";
        ParameterSetEntity next = newSet(userId, capped, asof, metricsJson(p), provenance);
        setRepo.save(next);

        String rationale = String.format(Locale.ROOT, "%s; fit_bias=%s kg; fit_mae=%s kg; cap=%.1f%%; reason=%s",
                notes == null ? "approved" : notes, p.getBiasKg(), p.getMaeKg(), p.getCapFraction() * 100,
                p.getCapReason() == null ? "none" : p.getCapReason());
        audit(userId, AuditLogEntity.Action.CHANGE_PARAMS, reviewer, rationale, base, next.getVersionId(), proposalId);

        log.info("proposal APPROVED. userId={} proposalId={} {} -> {} reviewer={}",
                userId, proposalId, base, next.getVersionId(), reviewer);
        return next;
    }

    @Transactional
    public ParameterProposalEntity reject(String proposalId, String reviewer, String notes) {
        requireReviewer(reviewer);
        ParameterProposalEntity p = requireProposal(proposalId);
        if (!p.isPending()) {
            throw new CalibrationException("PROPOSAL_ALREADY_REVIEWED", "proposal is " + p.getStatus());
        }

        int moved = proposalRepo.transitionFromPending(proposalId, ProposalStatus.REJECTED, reviewer, notes,
                Instant.now(clock));
        if (moved == 0) {
            throw new CalibrationException("PROPOSAL_ALREADY_REVIEWED", "proposal " + proposalId + " already reviewed");
        }

        audit(p.getUserId(), AuditLogEntity.Action.REJECT_PROPOSAL, reviewer,
                notes == null ? "not applied" : notes, p.getBaseVersion(), null, proposalId);
        log.info("proposal REJECTED. userId={} proposalId={} reviewer={}", p.getUserId(), proposalId, reviewer);
        return requireProposal(proposalId);
    }

    // ===== helpers =====

    private ParameterSetEntity newSet(Long userId, PhysioParameters params, LocalDate start, String metrics,
                                      String provenance) {
        ParameterSetEntity s = new ParameterSetEntity();
        s.setUserId(userId);
        s.setVersionId(nextVersionId(userId, start));
        s.setEffectiveStartDate(start);
        s.setEffectiveEndDate(null);
        s.setAlphaKcalPerKg(params.alpha());
        s.setCompensationC(params.c());
        s.setBmr0KcalPerDay(params.bmr0());
        s.setKLbmKcalPerKgPerDay(params.kLbm());
        s.setFitMetrics(metrics);
        s.setProvenance(provenance);
        return s;
    }

    String nextVersionId(Long userId, LocalDate start) {
        String base = VERSION_FMT.format(start);
        String candidate = base;
        int suffix = 2;
        while (setRepo.existsByUserIdAndVersionId(userId, candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private void audit(Long userId, AuditLogEntity.Action action, String actor, String rationale,
                       String previous, String next, String proposalId) {
        AuditLogEntity a = new AuditLogEntity();
        a.setUserId(userId);
        a.setAction(action);
        a.setActor(actor);
        a.setRationale(rationale);
        a.setPreviousVersion(previous);
        a.setNewVersion(next);
        a.setProposalId(proposalId);
        a.setCreatedAtUtc(Instant.now(clock));
        auditRepo.save(a);
    }

    private String metricsJson(ParameterProposalEntity p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("r2", p.getR2());
        m.put("mae_kg", p.getMaeKg());
        m.put("rmse_kg", p.getRmseKg());
        m.put("bias_kg", p.getBiasKg());
        m.put("condition_number", p.getConditionNumber());
        m.put("n_windows", p.getNWindows());
        m.put("fit_source", p.getFitSource());
        m.put("fallback_reason", p.getFallbackReason());
        try {
            return om.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("FIT_METRICS_SERIALIZE_FAILED", e);
        }
    }

    private static String capReason(CapResult cap, List<GuardrailViolation> violations) {
        StringBuilder sb = new StringBuilder();
        if (cap.anyCapped()) sb.append("capped: ").append(String.join(",", cap.cappedFields()));
        if (violations != null && !violations.isEmpty()) {
            if (!sb.isEmpty()) sb.append("; ");
            sb.append(violations.stream().map(GuardrailViolation::toString).collect(Collectors.joining("; ")));
        }
        return sb.isEmpty() ? null : sb.toString();
    }

    private static void requireReviewer(String reviewer) {
        if (reviewer == null || reviewer.isBlank()) throw new IllegalArgumentException("REVIEWER_REQUIRED");
    }
}
