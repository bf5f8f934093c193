package com.calai.calibration.calibration.repo;

import com.calai.calibration.calibration.entity.DailyStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DailyStateRepo extends JpaRepository<DailyStateEntity, Long> {

    @Query("""
           select s from DailyStateEntity s
           where s.userId = :uid
             and s.obsDate between :from and :to
           order by s.obsDate asc
           """)
    List<DailyStateEntity> findRange(@Param("uid") Long uid,
                                     @Param("from") LocalDate from,
                                     @Param("to") LocalDate to);
}
