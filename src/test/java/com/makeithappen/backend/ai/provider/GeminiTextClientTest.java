package com.makeithappen.backend.ai.provider;

import com.makeithappen.backend.ai.provider.config.GeminiProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.http.HttpClient;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiTextClientTest {

    private static final String PATH = "/v1beta/models/gemini-2.0-flash:generateContent";

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private final ObjectMapper om = new ObjectMapper();

    private GeminiTextClient client() {
        // HTTP/1.1 only; WireMock drops h2c upgrades
        HttpClient jdk = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        RestClient http = RestClient.builder()
                .baseUrl(wm.baseUrl())
                .requestFactory(new JdkClientHttpRequestFactory(jdk))
                .build();

        GeminiProperties props = new GeminiProperties();
        props.setApiKey("test-key");
        props.setModel("gemini-2.0-flash");
        props.setMaxOutputTokens(256);
        return new GeminiTextClient(http, props, om);
    }

    private String respWithParts(String... texts) throws Exception {
        ObjectNode root = om.createObjectNode();
        var parts = root.putArray("candidates").addObject().putObject("content").putArray("parts");
        for (String t : texts) parts.addObject().put("text", t);
        return om.writeValueAsString(root);
    }

    @Test
    void joins_all_text_parts_of_first_candidate() throws Exception {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .withHeader("x-goog-api-key", equalTo("test-key"))
                .willReturn(okJson(respWithParts("Draft the ", "intro paragraph."))));

        String out = client().complete("system", "user prompt", 0.6);

        assertThat(out).isEqualTo("Draft the intro paragraph.");
        wm.verify(postRequestedFor(urlPathEqualTo(PATH))
                .withRequestBody(matchingJsonPath("$.systemInstruction.parts[0].text", equalTo("system")))
                .withRequestBody(matchingJsonPath("$.contents[0].role", equalTo("user")))
                .withRequestBody(matchingJsonPath("$.contents[0].parts[0].text", equalTo("user prompt")))
                .withRequestBody(matchingJsonPath("$.generationConfig.maxOutputTokens", equalTo("256"))));
    }

    @Test
    void missing_candidates_yield_empty_text() {
        wm.stubFor(post(urlPathEqualTo(PATH)).willReturn(okJson("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}")));

        assertThat(client().complete(null, "p", 0.7)).isEmpty();
    }

    @Test
    void http_errors_propagate() {
        wm.stubFor(post(urlPathEqualTo(PATH)).willReturn(aResponse().withStatus(503).withBody("overloaded")));

        assertThatThrownBy(() -> client().complete("s", "p", 0.6))
                .isInstanceOf(RestClientResponseException.class);
    }

    @Test
    void blank_api_key_fails_before_calling_out() {
        GeminiProperties props = new GeminiProperties();
        GeminiTextClient c = new GeminiTextClient(RestClient.create(wm.baseUrl()), props, om);

        assertThatThrownBy(() -> c.complete("s", "p", 0.6))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("GEMINI_API_KEY_MISSING");
        assertThat(wm.getAllServeEvents()).isEmpty();
    }
}
