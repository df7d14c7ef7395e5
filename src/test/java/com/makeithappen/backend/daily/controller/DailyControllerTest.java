package com.makeithappen.backend.daily.controller;

import com.makeithappen.backend.auth.security.AccessTokenFilter;
import com.makeithappen.backend.auth.security.AuthContext;
import com.makeithappen.backend.common.web.ApiExceptionHandler;
import com.makeithappen.backend.common.web.RequestIdFilter;
import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.service.DailyActionService;
import com.makeithappen.backend.daily.web.ActionNotFoundException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(
        controllers = DailyController.class,
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class
        },
        excludeFilters = {
                @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = AccessTokenFilter.class)
        }
)
@Import({ApiExceptionHandler.class, RequestIdFilter.class})
class DailyControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean AuthContext auth;
    @MockitoBean DailyActionService service;

    @Test
    void today_lists_rows_with_carry_marker() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn("u1");
        DailyAction carried = DailyAction.fresh("u1", "p1", "Fitness", "Run 2 km", LocalDate.of(2026, 3, 10));
        carried.setId("a1");
        carried.setRescheduledFrom(LocalDate.of(2026, 3, 9));
        Mockito.when(service.today("u1")).thenReturn(List.of(carried));

        mvc.perform(get("/api/daily/today"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("a1"))
                .andExpect(jsonPath("$[0].focusArea").value("Fitness"))
                .andExpect(jsonPath("$[0].action").value("Run 2 km"))
                .andExpect(jsonPath("$[0].date").value("2026-03-10"))
                .andExpect(jsonPath("$[0].rescheduledFrom").value("2026-03-09"))
                .andExpect(jsonPath("$[0].completed").value(false));
    }

    @Test
    void check_in_success() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn("u1");

        mvc.perform(post("/api/daily/check-in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actionId\":\"a1\",\"completed\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        Mockito.verify(service).checkIn("u1", "a1", true);
    }

    @Test
    void check_in_unknown_action_is_404_with_request_id() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn("u1");
        Mockito.doThrow(new ActionNotFoundException("nope"))
                .when(service).checkIn(eq("u1"), eq("nope"), anyBoolean());

        mvc.perform(post("/api/daily/check-in")
                        .header("X-Request-Id", "RID-404")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actionId\":\"nope\",\"completed\":true}"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Request-Id", "RID-404"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.code").value("ACTION_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Action nope not found"));
    }

    @Test
    void check_in_without_action_id_is_400() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn("u1");

        mvc.perform(post("/api/daily/check-in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completed\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        Mockito.verifyNoInteractions(service);
    }

    @Test
    void missing_identity_is_401() throws Exception {
        Mockito.when(auth.requireUserId())
                .thenThrow(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED"));

        mvc.perform(get("/api/daily/today"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value("UNAUTHENTICATED"));
    }

    @Test
    void unexpected_failure_is_500_without_internals() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn("u1");
        Mockito.when(service.today("u1")).thenThrow(new RuntimeException("db password is hunter2"));

        mvc.perform(get("/api/daily/today"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Unexpected error"));
    }
}
