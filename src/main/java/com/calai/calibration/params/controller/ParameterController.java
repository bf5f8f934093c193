package com.calai.calibration.params.controller;

import com.calai.calibration.calibration.config.CalibrationDefaults;
import com.calai.calibration.fit.PhysioParameters;
import com.calai.calibration.params.dto.ParameterSetDto;
import com.calai.calibration.params.dto.ProposalDto;
import com.calai.calibration.params.dto.ReviewRequest;
import com.calai.calibration.params.dto.SeedParamsRequest;
import com.calai.calibration.params.entity.ProposalStatus;
import com.calai.calibration.params.service.ParameterVersionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Tag(name = "Parameters")
@RestController
@RequestMapping("/api/v1/params")
public class ParameterController {

    private final ParameterVersionService svc;
    private final CalibrationDefaults defaults;
    private final Clock clock;

    public ParameterController(ParameterVersionService svc, CalibrationDefaults defaults, Clock clock) {
        this.svc = svc;
        this.defaults = defaults;
        this.clock = clock;
    }

    @PostMapping(value = "/{userId}/seed", produces = MediaType.APPLICATION_JSON_VALUE)
    public ParameterSetDto seed(@PathVariable Long userId, @Valid @RequestBody SeedParamsRequest req) {
        PhysioParameters p = defaults.priors();
        PhysioParameters seed = new PhysioParameters(
                req.alpha() != null ? req.alpha() : p.alpha(),
                req.c() != null ? req.c() : p.c(),
                req.bmr0() != null ? req.bmr0() : p.bmr0(),
                req.kLbm() != null ? req.kLbm() : p.kLbm());
        return ParameterSetDto.from(svc.seedInitial(userId, seed, req.effectiveStart(), req.actor()));
    }

    @GetMapping(value = "/{userId}/active", produces = MediaType.APPLICATION_JSON_VALUE)
    public ParameterSetDto active(
            @PathVariable Long userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asof
    ) {
        LocalDate d = asof != null ? asof : LocalDate.now(clock);
        return ParameterSetDto.from(svc.requireActive(userId, d));
    }

    @GetMapping(value = "/{userId}/proposals", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProposalDto> proposals(@PathVariable Long userId,
                                       @RequestParam(required = false) ProposalStatus status) {
        return svc.proposals(userId, status).stream().map(ProposalDto::from).toList();
    }

    @PostMapping(value = "/proposals/{id}/approve", produces = MediaType.APPLICATION_JSON_VALUE)
    public ParameterSetDto approve(@PathVariable String id, @Valid @RequestBody ReviewRequest req) {
        return ParameterSetDto.from(svc.approve(id, req.reviewer(), req.notes()));
    }

    @PostMapping(value = "/proposals/{id}/reject", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProposalDto reject(@PathVariable String id, @Valid @RequestBody ReviewRequest req) {
        return ProposalDto.from(svc.reject(id, req.reviewer(), req.notes()));
    }
}
