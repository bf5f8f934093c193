package com.calai.calibration.observation.service;

import com.calai.calibration.observation.dto.ObservationItem;
import com.calai.calibration.observation.dto.UpsertObservationsResponse;
import com.calai.calibration.observation.entity.DailyObservationEntity;
import com.calai.calibration.observation.repo.DailyObservationRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationService {

    private final DailyObservationRepo repo;

    /** 依 (userId, date) upsert；同一批重複日期直接擋掉 */
    @Transactional
    public UpsertObservationsResponse upsert(Long userId, List<ObservationItem> items) {
        Set<LocalDate> seen = new HashSet<>();
        for (ObservationItem it : items) {
            if (!seen.add(it.date())) throw new IllegalArgumentException("DUPLICATE_DATE_IN_BATCH");
        }

        int inserted = 0;
        int updated = 0;
        for (ObservationItem it : items) {
            DailyObservationEntity e = repo.findByUserIdAndObsDate(userId, it.date()).orElse(null);
            if (e == null) {
                e = new DailyObservationEntity();
                e.setUserId(userId);
                e.setObsDate(it.date());
                inserted++;
            } else {
                updated++;
            }
            e.setIntakeKcal(it.intakeKcal());
            e.setWorkoutKcal(it.workoutKcal());
            e.setCarbohydrateG(it.carbohydrateG());
            e.setRawFatMassKg(it.rawFatMassKg());
            e.setRawLeanMassKg(it.rawLeanMassKg());
            repo.save(e);
        }

        log.info("observations upserted. userId={} inserted={} updated={}", userId, inserted, updated);
        return new UpsertObservationsResponse(userId, inserted, updated);
    }

    @Transactional(readOnly = true)
    public List<ObservationItem> range(Long userId, LocalDate from, LocalDate to) {
        if (from == null || to == null) throw new IllegalArgumentException("DATE_RANGE_REQUIRED");
        if (from.isAfter(to)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
        return repo.findRange(userId, from, to).stream()
                .map(o -> new ObservationItem(o.getObsDate(), o.getIntakeKcal(), o.getWorkoutKcal(),
                        o.getCarbohydrateG(), o.getRawFatMassKg(), o.getRawLeanMassKg()))
                .toList();
    }
}
