package com.makeithappen.backend.progress.controller;

import com.makeithappen.backend.auth.security.AuthContext;
import com.makeithappen.backend.progress.dto.ProgressDtos;
import com.makeithappen.backend.progress.service.ProgressService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ProgressController {

    private final ProgressService service;
    private final AuthContext auth;

    public ProgressController(ProgressService service, AuthContext auth) {
        this.service = service;
        this.auth = auth;
    }

    @GetMapping("/streak")
    public ProgressDtos.StreakResponse streak() {
        return service.calculateStreak(auth.requireUserId());
    }

    @GetMapping("/weekly-summary")
    public ProgressDtos.WeeklySummaryResponse weeklySummary() {
        return service.weeklySummary(auth.requireUserId());
    }

    @GetMapping("/progress")
    public ProgressDtos.ProgressResponse progress() {
        return service.recentProgress(auth.requireUserId());
    }
}
