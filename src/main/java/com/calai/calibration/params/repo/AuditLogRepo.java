package com.calai.calibration.params.repo;

import com.calai.calibration.params.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepo extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByProposalIdOrderByIdAsc(String proposalId);
}
