package com.makeithappen.backend.daily.controller;

import com.makeithappen.backend.auth.security.AuthContext;
import com.makeithappen.backend.daily.dto.DailyDtos;
import com.makeithappen.backend.daily.service.DailyActionService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/daily")
public class DailyController {

    private final DailyActionService service;
    private final AuthContext auth;

    public DailyController(DailyActionService service, AuthContext auth) {
        this.service = service;
        this.auth = auth;
    }

    @GetMapping("/today")
    public List<DailyDtos.DailyActionDto> today() {
        String userId = auth.requireUserId();
        return service.today(userId).stream()
                .map(DailyDtos.DailyActionDto::of)
                .toList();
    }

    @PostMapping("/check-in")
    public DailyDtos.CheckInResponse checkIn(@Valid @RequestBody DailyDtos.CheckInRequest req) {
        String userId = auth.requireUserId();
        service.checkIn(userId, req.actionId(), req.completed());
        return new DailyDtos.CheckInResponse(true);
    }
}
