package com.calai.calibration.observation;

import java.time.LocalDate;
import java.util.List;

/**
 * Boundary to upstream ingestion. Implementations own their retry/backoff; the numeric core only sees the list.
 */
public interface DailyRecordSource {

    /**
     * @return records ordered by date ascending, at most one per date, gaps allowed
     */
    List<DailyRecord> load(Long userId, LocalDate from, LocalDate to);
}
