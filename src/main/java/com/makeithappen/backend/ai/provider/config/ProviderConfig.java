package com.makeithappen.backend.ai.provider.config;

import com.makeithappen.backend.ai.provider.GeminiTextClient;
import com.makeithappen.backend.ai.provider.TextGenerationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * With gemini disabled no {@link TextGenerationClient} bean exists and every caller uses its fallback.
 */
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class ProviderConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public RestClient geminiRestClient(GeminiProperties props) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        f.setReadTimeout((int) props.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(f)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public TextGenerationClient geminiTextClient(RestClient geminiRestClient, GeminiProperties props, ObjectMapper om) {
        // fail fast at startup instead of on the first request
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (props.getModel() == null || props.getModel().isBlank()) throw new IllegalStateException("GEMINI_MODEL_MISSING");

        return new GeminiTextClient(geminiRestClient, props, om);
    }
}
