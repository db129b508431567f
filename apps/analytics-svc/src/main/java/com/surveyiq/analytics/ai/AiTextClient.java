package com.surveyiq.analytics.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.surveyiq.analytics.config.SurveyIqProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client for the OpenAI Responses API. Every failure is logged and surfaces as an empty result.
 */
@Component
public class AiTextClient {

    private static final Logger log = LoggerFactory.getLogger(AiTextClient.class);
    private static final int DEFAULT_MAX_TOKENS = 400;

    private final SurveyIqProperties properties;
    private final RestClient restClient;

    public record Message(String role, String content) {}

    public record ResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    public AiTextClient(SurveyIqProperties properties) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(Duration.ofSeconds(60));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
    }

    public boolean hasCredentials() {
        return properties.ai().hasApiKey();
    }

    public Optional<String> generateText(List<Message> inputMessages, Integer maxOutputTokens) {
        if (!hasCredentials()) {
            return Optional.empty();
        }
        int maxTokens = maxOutputTokens != null && maxOutputTokens > 0 ? maxOutputTokens : DEFAULT_MAX_TOKENS;
        ResponsesRequest requestBody = new ResponsesRequest(properties.ai().model(), inputMessages, maxTokens);

        try {
            JsonNode response = restClient.post()
                    .uri(properties.ai().endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(properties.ai().apiKey()))
                    .body(requestBody)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response.get("output_text"));
            }
            return Optional.ofNullable(text).filter(s -> !s.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("OpenAI Responses call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("OpenAI Responses call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    // Depth-first search for the first non-blank text in the Responses output tree.
    static String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        for (String field : List.of("content", "text")) {
            String nested = extractText(node.get(field));
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        return null;
    }
}
