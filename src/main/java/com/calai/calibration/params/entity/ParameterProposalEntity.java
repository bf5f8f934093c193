package com.calai.calibration.params.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * 校正提案：append-only，status 只會從 PENDING 轉一次（APPROVED / REJECTED）。
 */
@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "parameter_proposals",
        indexes = @Index(name = "idx_param_proposals_user_status", columnList = "user_id,proposal_status"))
public class ParameterProposalEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "asof_date", nullable = false)
    private LocalDate asofDate;

    @Column(name = "window_from", nullable = false)
    private LocalDate windowFrom;

    @Column(name = "window_to", nullable = false)
    private LocalDate windowTo;

    /** null = 提案時還沒有任何參數版本 */
    @Column(name = "base_version", length = 32)
    private String baseVersion;

    @Column(name = "fit_source", length = 16, nullable = false)
    private String fitSource;

    @Column(name = "fit_variant", length = 64, nullable = false)
    private String fitVariant;

    @Column(name = "fallback_reason", length = 64)
    private String fallbackReason;

    // ===== fitted =====
    @Column(name = "fit_alpha", nullable = false)
    private double fitAlpha;
    @Column(name = "fit_c", nullable = false)
    private double fitC;
    @Column(name = "fit_bmr0", nullable = false)
    private double fitBmr0;
    @Column(name = "fit_k_lbm", nullable = false)
    private double fitKLbm;

    // ===== capped =====
    @Column(name = "cap_fraction", nullable = false)
    private double capFraction;
    @Column(name = "capped_alpha", nullable = false)
    private double cappedAlpha;
    @Column(name = "capped_c", nullable = false)
    private double cappedC;
    @Column(name = "capped_bmr0", nullable = false)
    private double cappedBmr0;
    @Column(name = "capped_k_lbm", nullable = false)
    private double cappedKLbm;

    @Column(name = "cap_reason", columnDefinition = "TEXT")
    private String capReason;

    // ===== metrics =====
    @Column(name = "r2")
    private Double r2;
    @Column(name = "mae_kg")
    private Double maeKg;
    @Column(name = "rmse_kg")
    private Double rmseKg;
    @Column(name = "bias_kg")
    private Double biasKg;
    @Column(name = "condition_number")
    private Double conditionNumber;
    @Column(name = "n_windows", nullable = false)
    private int nWindows;

    @Column(name = "alpha_implied_min")
    private Double alphaImpliedMin;
    @Column(name = "alpha_implied_median")
    private Double alphaImpliedMedian;
    @Column(name = "alpha_implied_max")
    private Double alphaImpliedMax;

    // ===== bootstrap (nullable) =====
    @Column(name = "ci_alpha_low")
    private Double ciAlphaLow;
    @Column(name = "ci_alpha_high")
    private Double ciAlphaHigh;
    @Column(name = "ci_c_low")
    private Double ciCLow;
    @Column(name = "ci_c_high")
    private Double ciCHigh;
    @Column(name = "ci_bmr0_low")
    private Double ciBmr0Low;
    @Column(name = "ci_bmr0_high")
    private Double ciBmr0High;
    @Column(name = "ci_k_lbm_low")
    private Double ciKLbmLow;
    @Column(name = "ci_k_lbm_high")
    private Double ciKLbmHigh;
    @Column(name = "bootstrap_draws")
    private Integer bootstrapDraws;

    // ===== review =====
    @Enumerated(EnumType.STRING)
    @Column(name = "proposal_status", length = 16, nullable = false)
    private ProposalStatus status;

    @Column(name = "reviewer", length = 128)
    private String reviewer;

    @Column(name = "review_notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "reviewed_at_utc")
    private Instant reviewedAtUtc;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
        if (status == null) status = ProposalStatus.PENDING;
    }

    public boolean isPending() {
        return status == ProposalStatus.PENDING;
    }
}
