package com.calai.calibration.observation.repo;

import com.calai.calibration.observation.entity.DailyObservationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyObservationRepo extends JpaRepository<DailyObservationEntity, Long> {

    Optional<DailyObservationEntity> findByUserIdAndObsDate(Long userId, LocalDate obsDate);

    @Query("""
           select o from DailyObservationEntity o
           where o.userId = :uid
             and o.obsDate between :from and :to
           order by o.obsDate asc
           """)
    List<DailyObservationEntity> findRange(@Param("uid") Long uid,
                                           @Param("from") LocalDate from,
                                           @Param("to") LocalDate to);

    @Query("""
           select distinct o.userId from DailyObservationEntity o
           where o.obsDate between :from and :to
             and o.rawFatMassKg is not null
           """)
    List<Long> findUserIdsWithMeasurements(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
