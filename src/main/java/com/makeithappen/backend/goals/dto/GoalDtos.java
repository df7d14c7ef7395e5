package com.makeithappen.backend.goals.dto;

import com.makeithappen.backend.goals.entity.Plan;
import com.makeithappen.backend.goals.model.FocusArea;
import com.makeithappen.backend.goals.model.PlanStatus;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.List;

public class GoalDtos {

    /** POST /api/goals/dump */
    public record GoalDumpRequest(
            @NotBlank String text,
            List<String> images,
            @NotBlank String timeline
    ) {}

    public record GoalDumpResponse(
            String goalId,
            String planId,
            List<FocusArea> focusAreas
    ) {}

    public record PlanDto(
            String id,
            String goalId,
            List<FocusArea> focusAreas,
            String timeline,
            PlanStatus status,
            Instant createdAt
    ) {
        public static PlanDto of(Plan p) {
            return new PlanDto(p.getId(), p.getGoalId(), p.getFocusAreas(), p.getTimeline(), p.getStatus(), p.getCreatedAt());
        }
    }

    public record StartFreshResponse(boolean success, int archivedPlans, int deletedActions) {}
}
