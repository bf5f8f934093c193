package com.calai.calibration.calibration.job;

import com.calai.calibration.calibration.config.CalibrationProperties;
import com.calai.calibration.calibration.dto.RunCalibrationRequest;
import com.calai.calibration.calibration.service.CalibrationRunService;
import com.calai.calibration.observation.repo.DailyObservationRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 定期對有量測資料的使用者各跑一次校正，只產生 PENDING 提案，核准一律由人工。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PeriodicCalibrationJob {

    private final CalibrationProperties props;
    private final CalibrationRunService runService;
    private final DailyObservationRepo observationRepo;
    private final Clock clock;

    @Scheduled(cron = "${app.calibration.job.cron:0 30 3 1 * *}")
    public void runScheduled() {
        if (!props.getJob().isEnabled()) return;
        runOnce();
    }

    /** @return number of users that got a proposal */
    public int runOnce() {
        LocalDate to = LocalDate.now(clock).minusDays(1);
        LocalDate from = to.minusDays(props.getJob().getLookbackDays() - 1L);
        List<Long> users = observationRepo.findUserIdsWithMeasurements(from, to);

        int ok = 0;
        for (Long userId : users) {
            try {
                runService.run(new RunCalibrationRequest(userId, from, to, to.plusDays(1)));
                ok++;
            } catch (Exception e) {
                // 單一使用者失敗不影響其他人，run 本身已整筆 rollback
                log.warn("periodic calibration failed. userId={}", userId, e);
            }
        }
        log.info("periodic calibration finished. users={} proposals={} from={} to={}", users.size(), ok, from, to);
        return ok;
    }
}
