package com.makeithappen.backend.goals.controller;

import com.makeithappen.backend.auth.security.AuthContext;
import com.makeithappen.backend.goals.dto.GoalDtos;
import com.makeithappen.backend.goals.service.GoalIntakeService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/goals")
public class GoalController {

    private final GoalIntakeService intake;
    private final AuthContext auth;

    public GoalController(GoalIntakeService intake, AuthContext auth) {
        this.intake = intake;
        this.auth = auth;
    }

    @PostMapping("/dump")
    public GoalDtos.GoalDumpResponse dump(@Valid @RequestBody GoalDtos.GoalDumpRequest req) {
        return intake.dump(auth.requireUserId(), req);
    }
}
