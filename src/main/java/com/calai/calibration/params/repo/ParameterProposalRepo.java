package com.calai.calibration.params.repo;

import com.calai.calibration.params.entity.ParameterProposalEntity;
import com.calai.calibration.params.entity.ProposalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ParameterProposalRepo extends JpaRepository<ParameterProposalEntity, String> {

    List<ParameterProposalEntity> findByUserIdOrderByCreatedAtUtcDesc(Long userId);

    List<ParameterProposalEntity> findByUserIdAndStatusOrderByCreatedAtUtcDesc(Long userId, ProposalStatus status);

    /** PENDING 才能轉；回傳 0 代表已被審過 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update ParameterProposalEntity p
           set p.status = :to,
               p.reviewer = :reviewer,
               p.notes = :notes,
               p.reviewedAtUtc = :now
           where p.id = :id
             and p.status = com.calai.calibration.params.entity.ProposalStatus.PENDING
           """)
    int transitionFromPending(@Param("id") String id,
                              @Param("to") ProposalStatus to,
                              @Param("reviewer") String reviewer,
                              @Param("notes") String notes,
                              @Param("now") Instant now);
}
