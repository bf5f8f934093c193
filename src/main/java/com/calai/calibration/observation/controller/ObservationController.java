package com.calai.calibration.observation.controller;

import com.calai.calibration.observation.dto.ObservationItem;
import com.calai.calibration.observation.dto.UpsertObservationsRequest;
import com.calai.calibration.observation.dto.UpsertObservationsResponse;
import com.calai.calibration.observation.service.ObservationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Tag(name = "Observations")
@RestController
@RequestMapping("/api/v1/observations")
public class ObservationController {

    private final ObservationService svc;

    public ObservationController(ObservationService svc) {
        this.svc = svc;
    }

    @PutMapping(value = "/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public UpsertObservationsResponse upsert(@PathVariable Long userId,
                                             @Valid @RequestBody UpsertObservationsRequest req) {
        return svc.upsert(userId, req.items());
    }

    @GetMapping(value = "/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ObservationItem> range(
            @PathVariable Long userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return svc.range(userId, from, to);
    }
}
