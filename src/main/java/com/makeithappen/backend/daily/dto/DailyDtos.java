package com.makeithappen.backend.daily.dto;

import com.makeithappen.backend.daily.entity.DailyAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.time.LocalDate;

public class DailyDtos {

    public record DailyActionDto(
            String id,
            String planId,
            String focusArea,
            String action,
            LocalDate date,
            boolean completed,
            Instant completedAt,
            LocalDate rescheduledFrom
    ) {
        public static DailyActionDto of(DailyAction a) {
            return new DailyActionDto(
                    a.getId(),
                    a.getPlanId(),
                    a.getFocusArea(),
                    a.getActionText(),
                    a.getDay(),
                    a.isCompleted(),
                    a.getCompletedAt(),
                    a.getRescheduledFrom()
            );
        }
    }

    /** POST /api/daily/check-in */
    public record CheckInRequest(
            @NotBlank String actionId,
            @NotNull Boolean completed
    ) {}

    public record CheckInResponse(boolean success) {}
}
