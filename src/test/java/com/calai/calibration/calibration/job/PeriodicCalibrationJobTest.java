package com.calai.calibration.calibration.job;

import com.calai.calibration.calibration.config.CalibrationProperties;
import com.calai.calibration.calibration.dto.RunCalibrationRequest;
import com.calai.calibration.calibration.service.CalibrationRunService;
import com.calai.calibration.common.CalibrationException;
import com.calai.calibration.observation.repo.DailyObservationRepo;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class PeriodicCalibrationJobTest {

    private final CalibrationRunService runService = mock(CalibrationRunService.class);
    private final DailyObservationRepo repo = mock(DailyObservationRepo.class);
    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T03:30:00Z"), ZoneOffset.UTC);

    @Test
    void one_failing_user_does_not_stop_the_others() {
        CalibrationProperties props = new CalibrationProperties();
        props.getJob().setLookbackDays(120);
        LocalDate to = LocalDate.of(2025, 5, 31);
        LocalDate from = to.minusDays(119);
        when(repo.findUserIdsWithMeasurements(from, to)).thenReturn(List.of(1L, 2L, 3L));
        when(runService.run(argThat(r -> r != null && r.userId() == 2L)))
                .thenThrow(new CalibrationException("NOT_ENOUGH_WINDOWS", "no eligible windows"));

        int ok = new PeriodicCalibrationJob(props, runService, repo, clock).runOnce();

        assertThat(ok).isEqualTo(2);
        ArgumentCaptor<RunCalibrationRequest> req = ArgumentCaptor.forClass(RunCalibrationRequest.class);
        verify(runService, times(3)).run(req.capture());
        assertThat(req.getAllValues()).allSatisfy(r -> {
            assertThat(r.from()).isEqualTo(from);
            assertThat(r.to()).isEqualTo(to);
            assertThat(r.asof()).isEqualTo(LocalDate.of(2025, 6, 1));
        });
    }

    @Test
    void disabled_job_does_nothing() {
        CalibrationProperties props = new CalibrationProperties();
        props.getJob().setEnabled(false);

        new PeriodicCalibrationJob(props, runService, repo, clock).runScheduled();

        verifyNoInteractions(repo, runService);
        verify(runService, never()).run(any());
    }
}
