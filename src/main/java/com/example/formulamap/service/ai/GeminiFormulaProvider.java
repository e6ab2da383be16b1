package com.example.formulamap.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Google Gemini provider using the REST generateContent endpoint
 */
@Component
public class GeminiFormulaProvider implements FormulaAiProvider {

    private static final Logger logger = LoggerFactory.getLogger(GeminiFormulaProvider.class);

    static final String NAME = "Gemini";

    @Value("${ai.provider.gemini.enabled:true}")
    private boolean enabled;

    @Value("${ai.provider.gemini.api.key:}")
    private String apiKey;

    @Value("${ai.provider.gemini.model:gemini-2.5-flash}")
    private String modelName;

    @Value("${ai.provider.gemini.url:https://generativelanguage.googleapis.com/v1beta/models}")
    private String apiUrl;

    @Value("${ai.provider.gemini.priority:2}")
    private int priority;

    @Value("${ai.request.timeout-seconds:30}")
    private int timeoutSeconds = 30;

    @Autowired(required = false)
    private RateLimiterService rateLimiter;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GeminiFormulaProvider() {
        this.webClient = WebClient.builder()
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return enabled && apiKey != null && !apiKey.isEmpty();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, boolean jsonResponse) {
        if (!isEnabled()) {
            return null;
        }
        if (rateLimiter != null && !rateLimiter.acquire(NAME)) {
            logger.debug("Rate limit exceeded for Gemini, skipping request");
            return null;
        }

        try {
            logger.debug("🤖 Gemini: sending prompt (length: {})", userPrompt.length());
            String url = String.format("%s/%s:generateContent?key=%s", apiUrl, modelName, apiKey);
            String requestJson = objectMapper.writeValueAsString(buildRequest(systemPrompt, userPrompt, jsonResponse));

            String response = webClient.post()
                .uri(url)
                .bodyValue(requestJson)
                .retrieve()
                .onStatus(status -> status.isError(), clientResponse ->
                    Mono.error(new IllegalStateException("Gemini API error: " + clientResponse.statusCode())))
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .onErrorResume(TimeoutException.class, e -> {
                    logger.warn("⚠️ Gemini request timed out after {} seconds", timeoutSeconds);
                    return Mono.just("");
                })
                .block();

            return parseResponse(response);
        } catch (Exception e) {
            logger.warn("Gemini provider error: {}", e.getMessage());
            return null;
        }
    }

    Map<String, Object> buildRequest(String systemPrompt, String userPrompt, boolean jsonResponse) {
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", 0.3);
        if (jsonResponse) {
            generationConfig.put("responseMimeType", "application/json");
        }

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))));
        requestBody.put("contents", List.of(Map.of("parts", List.of(Map.of("text", userPrompt)))));
        requestBody.put("generationConfig", generationConfig);
        return requestBody;
    }

    String parseResponse(String response) {
        if (response == null || response.isEmpty()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            if (root.has("error")) {
                logger.warn("❌ Gemini API returned an error: {}", root.path("error").path("message").asText("Unknown error"));
                return null;
            }
            JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
            return text.isTextual() ? text.asText().trim() : null;
        } catch (Exception e) {
            logger.warn("Error parsing Gemini response: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean testConnection() {
        if (!isEnabled()) {
            return false;
        }
        return complete("You are a connectivity check.", "Reply with OK.", false) != null;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean isAvailable() {
        return isEnabled() && (rateLimiter == null || rateLimiter.wouldAllow(NAME));
    }
}
