package com.calai.calibration.calibration.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 每次 run 重算的清洗/估計序列（稽核用），以 (user_id, obs_date) upsert。
 */
@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "daily_state_estimates",
        uniqueConstraints = @UniqueConstraint(name = "uq_daily_state_user_date", columnNames = {"user_id", "obs_date"}))
public class DailyStateEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "obs_date", nullable = false)
    private LocalDate obsDate;

    @Column(name = "cleaned_fat_kg")
    private Double cleanedFatKg;

    @Column(name = "cleaned_lean_kg")
    private Double cleanedLeanKg;

    @Column(name = "filtered_fat_kg")
    private Double filteredFatKg;

    @Column(name = "filtered_variance")
    private Double filteredVariance;

    @Column(name = "kalman_gain")
    private Double kalmanGain;

    @Column(name = "smoothed_fat_kg")
    private Double smoothedFatKg;

    @Column(name = "smoothed_variance")
    private Double smoothedVariance;

    @Column(name = "trend_fat_kg")
    private Double trendFatKg;

    @Column(name = "hydration_kg")
    private Double hydrationKg;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAtUtc = Instant.now();
    }
}
