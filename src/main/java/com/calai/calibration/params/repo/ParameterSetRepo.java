package com.calai.calibration.params.repo;

import com.calai.calibration.params.entity.ParameterSetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ParameterSetRepo extends JpaRepository<ParameterSetEntity, String> {

    @Query("""
           select s from ParameterSetEntity s
           where s.userId = :uid
             and s.effectiveStartDate <= :asof
             and (s.effectiveEndDate is null or s.effectiveEndDate >= :asof)
           order by s.effectiveStartDate desc
           """)
    List<ParameterSetEntity> findActiveAt(@Param("uid") Long uid, @Param("asof") LocalDate asof);

    @Query("""
           select s from ParameterSetEntity s
           where s.userId = :uid and s.effectiveEndDate is null
           """)
    Optional<ParameterSetEntity> findOpen(@Param("uid") Long uid);

    Optional<ParameterSetEntity> findByUserIdAndVersionId(Long userId, String versionId);

    boolean existsByUserIdAndVersionId(Long userId, String versionId);

    /** 只有 base 仍是生效版本（end_date 為 null）才會關閉；回傳 0 代表已被別人取代 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update ParameterSetEntity s
           set s.effectiveEndDate = :endDate
           where s.userId = :uid
             and s.versionId = :versionId
             and s.effectiveEndDate is null
           """)
    int closeIfOpen(@Param("uid") Long uid,
                    @Param("versionId") String versionId,
                    @Param("endDate") LocalDate endDate);
}
