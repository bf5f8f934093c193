package com.calai.calibration.params.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * 參數版本：建立後不可改，只有 effective_end_date 會在被取代時關閉。
 */
@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "parameter_sets",
        uniqueConstraints = @UniqueConstraint(name = "uq_param_sets_user_version", columnNames = {"user_id", "version_id"}),
        indexes = @Index(name = "idx_param_sets_user_effective", columnList = "user_id,effective_start_date"))
public class ParameterSetEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "version_id", length = 32, nullable = false)
    private String versionId;

    @Column(name = "effective_start_date", nullable = false)
    private LocalDate effectiveStartDate;

    /** null = 目前生效中 */
    @Column(name = "effective_end_date")
    private LocalDate effectiveEndDate;

    @Column(name = "alpha_kcal_per_kg", nullable = false)
    private double alphaKcalPerKg;

    @Column(name = "compensation_c", nullable = false)
    private double compensationC;

    @Column(name = "bmr0_kcal_per_day", nullable = false)
    private double bmr0KcalPerDay;

    @Column(name = "k_lbm_kcal_per_kg_per_day", nullable = false)
    private double kLbmKcalPerKgPerDay;

    @Column(name = "fit_metrics", columnDefinition = "TEXT")
    private String fitMetrics;

    @Column(name = "provenance", length = 512)
    private String provenance;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
