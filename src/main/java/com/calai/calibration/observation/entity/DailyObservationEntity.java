package com.calai.calibration.observation.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "daily_observations",
        uniqueConstraints = @UniqueConstraint(name = "uq_daily_obs_user_date", columnNames = {"user_id", "obs_date"}))
public class DailyObservationEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "obs_date", nullable = false)
    private LocalDate obsDate;

    @Column(name = "intake_kcal")
    private Double intakeKcal;

    @Column(name = "workout_kcal")
    private Double workoutKcal;

    @Column(name = "carbohydrate_g")
    private Double carbohydrateG;

    /** 體脂量（kg），可為 null */
    @Column(name = "raw_fat_mass_kg")
    private Double rawFatMassKg;

    @Column(name = "raw_lean_mass_kg")
    private Double rawLeanMassKg;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
