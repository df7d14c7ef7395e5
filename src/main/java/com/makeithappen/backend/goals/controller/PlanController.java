package com.makeithappen.backend.goals.controller;

import com.makeithappen.backend.auth.security.AuthContext;
import com.makeithappen.backend.goals.dto.GoalDtos;
import com.makeithappen.backend.goals.service.PlanService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/plans")
public class PlanController {

    private final PlanService service;
    private final AuthContext auth;

    public PlanController(PlanService service, AuthContext auth) {
        this.service = service;
        this.auth = auth;
    }

    /** 204 when the user has no active plan. */
    @GetMapping("/current")
    public ResponseEntity<GoalDtos.PlanDto> current() {
        return service.current(auth.requireUserId())
                .map(p -> ResponseEntity.ok(GoalDtos.PlanDto.of(p)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping
    public List<GoalDtos.PlanDto> list() {
        return service.list(auth.requireUserId()).stream().map(GoalDtos.PlanDto::of).toList();
    }

    @PostMapping("/start-fresh")
    public GoalDtos.StartFreshResponse startFresh() {
        return service.startFresh(auth.requireUserId());
    }
}
