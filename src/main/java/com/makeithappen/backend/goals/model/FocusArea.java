package com.makeithappen.backend.goals.model;

import java.util.List;

/**
 * Thematic sub-goal of a plan. {@code name} is the key that links daily actions across days.
 */
public record FocusArea(
        String name,
        String description,
        String successCriteria,
        List<String> outcomes,
        String monthlyDirection,
        String weeklyFocus,
        String dailyActionSeed
) {

    public static final String DEFAULT_NAME = "Focus";

    public FocusArea {
        name = (name == null || name.isBlank()) ? DEFAULT_NAME : name.trim();
        description = nullToEmpty(description);
        successCriteria = nullToEmpty(successCriteria);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        monthlyDirection = nullToEmpty(monthlyDirection);
        weeklyFocus = nullToEmpty(weeklyFocus);
        dailyActionSeed = nullToEmpty(dailyActionSeed);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
