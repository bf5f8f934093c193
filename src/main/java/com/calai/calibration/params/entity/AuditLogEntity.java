package com.calai.calibration.params.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "parameter_audit_log",
        indexes = @Index(name = "idx_param_audit_user", columnList = "user_id,created_at_utc"))
public class AuditLogEntity {

    public enum Action { CHANGE_PARAMS, REJECT_PROPOSAL }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 32, nullable = false)
    private Action action;

    @Column(name = "actor", length = 128, nullable = false)
    private String actor;

    @Column(name = "rationale", columnDefinition = "TEXT")
    private String rationale;

    @Column(name = "previous_version", length = 32)
    private String previousVersion;

    @Column(name = "new_version", length = 32)
    private String newVersion;

    @Column(name = "proposal_id", length = 36)
    private String proposalId;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
