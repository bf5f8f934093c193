package com.calai.calibration.common.web;

import com.calai.calibration.calibration.config.CalibrationDefaults;
import com.calai.calibration.common.CalibrationException;
import com.calai.calibration.params.StaleBaseVersionException;
import com.calai.calibration.params.controller.ParameterController;
import com.calai.calibration.params.service.ParameterVersionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ActiveProfiles("test")
@WebMvcTest(controllers = ParameterController.class)
@Import({ApiExceptionHandler.class, RequestTraceFilter.class})
class ApiExceptionHandlerTest {

    @Autowired MockMvc mvc;

    @MockitoBean ParameterVersionService svc;
    @MockitoBean CalibrationDefaults defaults;
    @MockitoBean Clock clock;

    @Test
    void stale_base_maps_to_409_with_request_id() throws Exception {
        when(svc.approve(eq("p-1"), eq("alice"), any())).thenThrow(new StaleBaseVersionException("superseded"));

        mvc.perform(post("/api/v1/params/proposals/p-1/approve")
                        .header(RequestTraceFilter.HEADER, "req-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewer\":\"alice\"}"))
                .andExpect(status().isConflict())
                .andExpect(header().string(RequestTraceFilter.HEADER, "req-42"))
                .andExpect(jsonPath("$.code").value("STALE_BASE_VERSION"))
                .andExpect(jsonPath("$.requestId").value("req-42"));
    }

    @Test
    void unknown_proposal_maps_to_404() throws Exception {
        when(svc.reject(eq("nope"), eq("bob"), any()))
                .thenThrow(new CalibrationException("PROPOSAL_NOT_FOUND", "proposal nope not found"));

        mvc.perform(post("/api/v1/params/proposals/nope/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewer\":\"bob\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PROPOSAL_NOT_FOUND"));
    }

    @Test
    void blank_reviewer_fails_validation() throws Exception {
        mvc.perform(post("/api/v1/params/proposals/p-1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewer\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void malformed_date_is_bad_request() throws Exception {
        mvc.perform(get("/api/v1/params/7/active").param("asof", "2025-13-40"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void missing_active_set_maps_to_404() throws Exception {
        when(svc.requireActive(eq(7L), any()))
                .thenThrow(new CalibrationException("PARAMS_NOT_FOUND", "none"));

        mvc.perform(get("/api/v1/params/7/active").param("asof", "2025-06-01"))
                .andExpect(status().isNotFound());
    }

    @Test
    void status_table() {
        assertThat(ApiExceptionHandler.statusOf("NOT_ENOUGH_WINDOWS")).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ApiExceptionHandler.statusOf("NO_MEASUREMENTS")).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ApiExceptionHandler.statusOf("IMPLAUSIBLE_PARAMETERS")).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ApiExceptionHandler.statusOf("PROPOSAL_ALREADY_REVIEWED")).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ApiExceptionHandler.statusOf("RUN_BUDGET_EXCEEDED")).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(ApiExceptionHandler.statusOf("SOMETHING_ELSE")).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
