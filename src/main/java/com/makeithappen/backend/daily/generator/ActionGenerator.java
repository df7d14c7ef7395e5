package com.makeithappen.backend.daily.generator;

import com.makeithappen.backend.ai.provider.TextGenerationClient;
import com.makeithappen.backend.goals.model.FocusArea;
import com.makeithappen.backend.goals.model.TimelineContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces one action sentence for a focus area. Never throws and never returns blank:
 * no client, a failed call or empty output all resolve to {@link FallbackActions}.
 */
@Slf4j
@Component
public class ActionGenerator {

    static final double TEMPERATURE = 0.6;

    static final String SYSTEM_PROMPT =
            "You are a practical, encouraging coach. "
            + "Generate a single concrete, specific action for TODAY that takes 15–30 minutes. "
            + "It must build on yesterday's work and aim toward the user's timeline goal. "
            + "No generic advice. No multi-step lists. Output ONLY the action sentence.";

    private final TextGenerationClient client;
    private final ObjectMapper om;

    @Autowired
    public ActionGenerator(ObjectProvider<TextGenerationClient> client, ObjectMapper om) {
        this(client.getIfAvailable(), om);
    }

    /** @param client null disables generation */
    public ActionGenerator(TextGenerationClient client, ObjectMapper om) {
        this.client = client;
        this.om = om;
    }

    public boolean isGenerationEnabled() {
        return client != null;
    }

    /**
     * @param yesterday previous-day actions of this focus area only
     * @param dayIndex  days since the plan's first recorded action
     * @param timeline  plan timeline tag
     */
    public String generate(FocusArea area, List<YesterdayAction> yesterday, int dayIndex, String timeline) {
        if (client == null) return FallbackActions.nextAction(area, dayIndex);

        try {
            String out = client.complete(SYSTEM_PROMPT, buildPrompt(area, yesterday, dayIndex, timeline), TEMPERATURE);
            String first = firstLine(out);
            if (first.isEmpty()) {
                log.warn("next_action_empty provider={} focusArea={} dayIndex={}",
                        client.providerCode(), area.name(), dayIndex);
                return FallbackActions.nextAction(area, dayIndex);
            }
            return first;
        } catch (Exception e) {
            log.warn("next_action_failed provider={} focusArea={} dayIndex={}; using fallback",
                    client.providerCode(), area.name(), dayIndex, e);
            return FallbackActions.nextAction(area, dayIndex);
        }
    }

    String buildPrompt(FocusArea area, List<YesterdayAction> yesterday, int dayIndex, String timeline) throws Exception {
        List<Map<String, Object>> items = yesterday.stream()
                .map(y -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("action", y.action());
                    m.put("completed", y.completed());
                    return m;
                })
                .toList();

        return """
                Timeline: %s

                Focus area:
                - name: %s
                - monthly_direction: %s
                - weekly_focus: %s
                - success_looks_like: %s
                - outcomes: %s

                Yesterday actions for this focus area (completed/incomplete):
                %s

                Day index since plan started: %d

                Write ONE action for today (15–30 min) that:
                - continues unfinished work if any unfinished exists
                - otherwise progresses logically from completed work
                - is concrete (send X message, draft Y, practice Z minutes, etc.)

                Return ONLY the action sentence.
                """.formatted(
                TimelineContext.describe(timeline),
                area.name(),
                area.monthlyDirection(),
                area.weeklyFocus(),
                area.successCriteria(),
                om.writeValueAsString(area.outcomes()),
                om.writeValueAsString(items),
                dayIndex
        ).strip();
    }

    static String firstLine(String raw) {
        if (raw == null) return "";
        String s = raw.strip();
        if (s.isEmpty()) return "";
        return s.lines().findFirst().orElse("").strip();
    }
}
