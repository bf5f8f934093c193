package com.calai.calibration.calibration.controller;

import com.calai.calibration.calibration.dto.DailyStateDto;
import com.calai.calibration.calibration.dto.RunCalibrationRequest;
import com.calai.calibration.calibration.dto.RunCalibrationResponse;
import com.calai.calibration.calibration.service.CalibrationRunService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Tag(name = "Calibration")
@RestController
@RequestMapping("/api/v1/calibration")
public class CalibrationController {

    private final CalibrationRunService svc;

    public CalibrationController(CalibrationRunService svc) {
        this.svc = svc;
    }

    @PostMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public RunCalibrationResponse run(@Valid @RequestBody RunCalibrationRequest req) {
        return svc.run(req);
    }

    @GetMapping(value = "/{userId}/states", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DailyStateDto> states(
            @PathVariable Long userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return svc.states(userId, from, to);
    }
}
