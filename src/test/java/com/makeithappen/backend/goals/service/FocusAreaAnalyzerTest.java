package com.makeithappen.backend.goals.service;

import com.makeithappen.backend.ai.provider.TextGenerationClient;
import com.makeithappen.backend.goals.model.FocusArea;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FocusAreaAnalyzerTest {

    private final ObjectMapper om = new ObjectMapper();

    private FocusAreaAnalyzer withOutput(String out) throws Exception {
        TextGenerationClient client = mock(TextGenerationClient.class);
        when(client.providerCode()).thenReturn("FAKE");
        when(client.complete(anyString(), anyString(), anyDouble())).thenReturn(out);
        return new FocusAreaAnalyzer(client, om);
    }

    @Test
    void parses_focus_areas_wrapped_in_chatter() throws Exception {
        String out = """
                Sure! Here is your plan:
                ```json
                {"focus_areas":[
                  {"name":"Fitness","description":"Move","success_looks_like":"Run 5k",
                   "outcomes":["Run 3x/week",""],"monthly_direction":"Base","weekly_focus":"Two runs",
                   "daily_action":"Walk 20 min"},
                  {"name":"Career","outcomes":"not-a-list"}
                ]}
                ```
                """;

        List<FocusArea> areas = withOutput(out).analyze("get fit", "3_months");

        assertThat(areas).hasSize(2);
        FocusArea fitness = areas.get(0);
        assertThat(fitness.name()).isEqualTo("Fitness");
        assertThat(fitness.successCriteria()).isEqualTo("Run 5k");
        assertThat(fitness.outcomes()).containsExactly("Run 3x/week");
        assertThat(fitness.weeklyFocus()).isEqualTo("Two runs");
        assertThat(fitness.dailyActionSeed()).isEqualTo("Walk 20 min");

        FocusArea career = areas.get(1);
        assertThat(career.outcomes()).isEmpty();
        assertThat(career.weeklyFocus()).isEmpty();
    }

    @Test
    void caps_at_four_and_names_missing_areas() throws Exception {
        String out = """
                {"focus_areas":[{"name":"A"},{"name":"B"},{"name":""},{"name":"D"},{"name":"E"}]}
                """;

        List<FocusArea> areas = withOutput(out).analyze("lots", "1_year");

        assertThat(areas).extracting(FocusArea::name).containsExactly("A", "B", FocusArea.DEFAULT_NAME, "D");
    }

    @Test
    void unnamed_areas_get_distinct_names_and_repeated_names_are_dropped() throws Exception {
        String out = """
                {"focus_areas":[{"name":""},{"name":null},{"name":"Fitness"},{"name":" Fitness "}]}
                """;

        List<FocusArea> areas = withOutput(out).analyze("lots", "1_year");

        assertThat(areas).extracting(FocusArea::name).containsExactly("Focus", "Focus 2", "Fitness");
        assertThat(areas).extracting(FocusArea::name).doesNotHaveDuplicates();
    }

    @Test
    void unparsable_or_empty_output_uses_fallback_plan() throws Exception {
        assertThat(withOutput("no json here").analyze("x", "1_month"))
                .extracting(FocusArea::name).containsExactly("Clarity", "Momentum");
        assertThat(withOutput("{\"focus_areas\":[]}").analyze("x", "1_month"))
                .extracting(FocusArea::name).containsExactly("Clarity", "Momentum");
        assertThat(withOutput("{broken").analyze("x", "1_month"))
                .extracting(FocusArea::name).containsExactly("Clarity", "Momentum");
    }

    @Test
    void provider_failure_or_missing_client_uses_fallback_plan() throws Exception {
        TextGenerationClient client = mock(TextGenerationClient.class);
        when(client.providerCode()).thenReturn("FAKE");
        when(client.complete(anyString(), anyString(), anyDouble())).thenThrow(new RuntimeException("timeout"));

        assertThat(new FocusAreaAnalyzer(client, om).analyze("x", "1_month")).hasSize(2);
        assertThat(new FocusAreaAnalyzer((TextGenerationClient) null, om).analyze("x", "1_month"))
                .allSatisfy(a -> assertThat(a.dailyActionSeed()).isNotBlank());
    }

    @Test
    void prompt_includes_timeline_context() {
        assertThat(FocusAreaAnalyzer.buildPrompt("  run a marathon ", "new_year"))
                .contains("run a marathon")
                .contains("Timeline: ")
                .contains("\"focus_areas\"");
    }
}
