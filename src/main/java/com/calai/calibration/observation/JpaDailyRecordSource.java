package com.calai.calibration.observation;

import com.calai.calibration.observation.repo.DailyObservationRepo;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Component
public class JpaDailyRecordSource implements DailyRecordSource {

    private final DailyObservationRepo repo;

    public JpaDailyRecordSource(DailyObservationRepo repo) {
        this.repo = repo;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DailyRecord> load(Long userId, LocalDate from, LocalDate to) {
        return repo.findRange(userId, from, to).stream()
                .map(o -> new DailyRecord(
                        o.getObsDate(),
                        o.getIntakeKcal(),
                        o.getWorkoutKcal(),
                        o.getCarbohydrateG(),
                        o.getRawFatMassKg(),
                        o.getRawLeanMassKg()))
                .toList();
    }
}
