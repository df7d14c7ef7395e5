package com.makeithappen.backend.progress.dto;

import com.makeithappen.backend.daily.dto.DailyDtos;

import java.time.LocalDate;
import java.util.List;

public class ProgressDtos {

    public record StreakResponse(
            int currentStreak,
            int longestStreak,
            int totalCompleted,
            String message
    ) {}

    public record FocusAreaProgress(
            String name,
            int completed,
            int total,
            double rate
    ) {}

    public record WeeklySummaryResponse(
            LocalDate weekStart,
            LocalDate weekEnd,
            int totalActions,
            int completedActions,
            double completionRate,
            List<FocusAreaProgress> focusAreasProgress,
            List<String> wins,
            String momentumMessage
    ) {}

    /** Last 30 logical days, oldest first. */
    public record ProgressResponse(
            int totalActions,
            int completedActions,
            double completionRate,
            List<DailyDtos.DailyActionDto> actions
    ) {}
}
