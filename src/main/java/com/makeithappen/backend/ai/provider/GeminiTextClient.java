package com.makeithappen.backend.ai.provider;

import com.makeithappen.backend.ai.provider.config.GeminiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Text-only generateContent call. HTTP errors propagate as RestClientResponseException.
 */
@Slf4j
public class GeminiTextClient implements TextGenerationClient {

    private static final int PREVIEW_LEN = 200;

    private final RestClient http;
    private final GeminiProperties props;
    private final ObjectMapper om;

    public GeminiTextClient(RestClient http, GeminiProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public String providerCode() { return "GEMINI"; }

    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature) {
        long t0 = System.nanoTime();
        ObjectNode req = buildRequest(systemPrompt, userPrompt, temperature);

        JsonNode resp = http.post()
                .uri("/v1beta/models/{model}:generateContent", props.getModel())
                .header("x-goog-api-key", requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);

        String text = extractJoinedText(resp);
        log.debug("gemini_text modelId={} latencyMs={} preview={}",
                props.getModel(), (System.nanoTime() - t0) / 1_000_000L, preview(text));
        return text;
    }

    private ObjectNode buildRequest(String systemPrompt, String userPrompt, double temperature) {
        ObjectNode root = om.createObjectNode();

        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode sys = root.putObject("systemInstruction");
            sys.putArray("parts").addObject().put("text", systemPrompt);
        }

        ArrayNode contents = root.putArray("contents");
        ObjectNode c0 = contents.addObject();
        c0.put("role", "user");
        c0.putArray("parts").addObject().put("text", userPrompt);

        ObjectNode gen = root.putObject("generationConfig");
        gen.put("maxOutputTokens", props.getMaxOutputTokens());
        gen.put("temperature", temperature);

        return root;
    }

    /** Concatenates candidates[0].content.parts[*].text; empty string when absent. */
    static String extractJoinedText(JsonNode resp) {
        if (resp == null) return "";
        JsonNode parts = resp.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return "";

        StringBuilder sb = new StringBuilder();
        for (JsonNode p : parts) {
            JsonNode t = p.get("text");
            if (t != null && t.isTextual()) sb.append(t.asText());
        }
        return sb.toString();
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        return k;
    }

    private static String preview(String s) {
        if (s == null) return "";
        String one = s.replace('\n', ' ').replace('\r', ' ').trim();
        return one.length() <= PREVIEW_LEN ? one : one.substring(0, PREVIEW_LEN) + "...";
    }
}
