package com.makeithappen.backend.goals.service;

import com.makeithappen.backend.ai.provider.TextGenerationClient;
import com.makeithappen.backend.goals.model.FocusArea;
import com.makeithappen.backend.goals.model.TimelineContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a free-form goal dump into 2-4 focus areas.
 * Malformed or empty model output is dropped; nothing usable means the fixed two-area plan.
 */
@Slf4j
@Component
public class FocusAreaAnalyzer {

    static final int MAX_FOCUS_AREAS = 4;
    static final double TEMPERATURE = 0.7;

    static final String SYSTEM_PROMPT =
            "You are a thoughtful life coach who helps people translate dreams into actionable plans. "
            + "Be warm, encouraging, and practical. Always provide concrete, specific actions.";

    private final TextGenerationClient client;
    private final ObjectMapper om;

    @Autowired
    public FocusAreaAnalyzer(ObjectProvider<TextGenerationClient> client, ObjectMapper om) {
        this(client.getIfAvailable(), om);
    }

    public FocusAreaAnalyzer(TextGenerationClient client, ObjectMapper om) {
        this.client = client;
        this.om = om;
    }

    public List<FocusArea> analyze(String text, String timeline) {
        if (client == null) {
            log.warn("focus_area_generation_disabled; using fallback plan");
            return fallbackFocusAreas();
        }

        try {
            String out = client.complete(SYSTEM_PROMPT, buildPrompt(text, timeline), TEMPERATURE);
            List<FocusArea> parsed = parseFocusAreas(out);
            if (parsed.isEmpty()) {
                log.warn("focus_area_empty provider={}; using fallback plan", client.providerCode());
                return fallbackFocusAreas();
            }
            return parsed;
        } catch (Exception e) {
            log.warn("focus_area_failed provider={}; using fallback plan", client.providerCode(), e);
            return fallbackFocusAreas();
        }
    }

    static String buildPrompt(String text, String timeline) {
        return """
                Analyze this person's goals and aspirations:

                %s

                Timeline: %s

                Extract 2-4 main focus areas.

                For each focus area, provide:
                name, description, success_looks_like, outcomes (2-3),
                monthly_direction, weekly_focus, daily_action (ONE concrete action for today, 15–30 min)

                Respond ONLY in JSON:
                {
                 "focus_areas": [
                   {
                     "name": "...",
                     "description": "...",
                     "success_looks_like": "...",
                     "outcomes": ["...", "..."],
                     "monthly_direction": "...",
                     "weekly_focus": "...",
                     "daily_action": "..."
                   }
                 ]
                }
                """.formatted(text == null ? "" : text.strip(), TimelineContext.describe(timeline)).strip();
    }

    /** Reads the outermost {...} block; anything unparsable yields an empty list. */
    List<FocusArea> parseFocusAreas(String raw) {
        if (raw == null) return List.of();
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) return List.of();

        JsonNode root;
        try {
            root = om.readTree(raw.substring(start, end + 1));
        } catch (Exception e) {
            log.debug("focus_area_json_parse_failed: {}", e.getMessage());
            return List.of();
        }

        JsonNode arr = root.path("focus_areas");
        if (!arr.isArray()) return List.of();

        // names key actions across days, so they must be unique within a plan
        Set<String> seen = new HashSet<>();
        List<FocusArea> out = new ArrayList<>();
        for (JsonNode n : arr) {
            if (!n.isObject()) continue;
            if (out.size() >= MAX_FOCUS_AREAS) break;

            String name = text(n, "name");
            if (name == null || name.isBlank()) {
                name = unusedDefaultName(seen);
            } else if (seen.contains(name.trim())) {
                log.debug("focus_area_duplicate_dropped name={}", name.trim());
                continue;
            }
            seen.add(name.trim());

            out.add(new FocusArea(
                    name,
                    text(n, "description"),
                    text(n, "success_looks_like"),
                    strings(n.path("outcomes")),
                    text(n, "monthly_direction"),
                    text(n, "weekly_focus"),
                    text(n, "daily_action")
            ));
        }
        return out;
    }

    private static String unusedDefaultName(Set<String> seen) {
        if (!seen.contains(FocusArea.DEFAULT_NAME)) return FocusArea.DEFAULT_NAME;
        int i = 2;
        while (seen.contains(FocusArea.DEFAULT_NAME + " " + i)) i++;
        return FocusArea.DEFAULT_NAME + " " + i;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull() || v.isContainerNode()) ? null : v.asText();
    }

    private static List<String> strings(JsonNode arr) {
        if (!arr.isArray()) return List.of();
        List<String> out = new ArrayList<>();
        for (JsonNode v : arr) {
            if (v.isValueNode() && !v.isNull() && !v.asText().isBlank()) out.add(v.asText().trim());
        }
        return out;
    }

    public static List<FocusArea> fallbackFocusAreas() {
        return List.of(
                new FocusArea(
                        "Clarity",
                        "Turn your dump into a few clear priorities you can actually act on.",
                        "You can explain your top 3 goals and your next step for each.",
                        List.of("Pick your top 3 priorities", "Define a next step for each"),
                        "Clarify what matters most and remove distractions.",
                        "Choose one priority to focus on this week.",
                        "Write your top 3 goals as bullets and circle the #1 (5–10 min)."
                ),
                new FocusArea(
                        "Momentum",
                        "Build consistency with tiny daily actions (no guilt, just progress).",
                        "You complete at least 1 small action per day most days.",
                        List.of("Set a 15-minute daily habit", "Track daily check-ins"),
                        "Make progress feel easy and repeatable.",
                        "Do the smallest version of the work daily.",
                        "Set a 15-minute timer and do the smallest next step for your #1 goal."
                )
        );
    }
}
