package com.makeithappen.backend.goals.model;

import java.util.Map;

/** Coaching context sentence for a plan's timeline tag, shared by every prompt. */
public final class TimelineContext {

    private static final Map<String, String> CONTEXT = Map.of(
            "1_month", "They want to achieve this in 1 month. Break it into weekly milestones.",
            "3_months", "They have 3 months. Create sustainable monthly phases.",
            "6_months", "They have 6 months. Build gradually with clear monthly themes.",
            "1_year", "They have a year. Create quarterly milestones with monthly focuses.",
            "new_year", "New Year's resolution. Start in January with quarterly check-ins."
    );

    private static final String DEFAULT = "Create a balanced plan based on goal complexity.";

    private TimelineContext() {}

    public static String describe(String timeline) {
        if (timeline == null) return DEFAULT;
        return CONTEXT.getOrDefault(timeline.trim(), DEFAULT);
    }
}
