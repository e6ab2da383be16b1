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

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completions provider
 */
@Component
public class OpenAiFormulaProvider implements FormulaAiProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiFormulaProvider.class);

    static final String NAME = "OpenAI";

    @Value("${ai.provider.openai.enabled:true}")
    private boolean enabled;

    @Value("${ai.provider.openai.api.key:}")
    private String apiKey;

    @Value("${ai.provider.openai.model:gpt-4o}")
    private String model;

    @Value("${ai.provider.openai.url:https://api.openai.com/v1/chat/completions}")
    private String apiUrl;

    @Value("${ai.provider.openai.priority:1}")
    private int priority;

    @Value("${ai.request.timeout-seconds:30}")
    private int timeoutSeconds = 30;

    @Autowired(required = false)
    private RateLimiterService rateLimiter;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OpenAiFormulaProvider() {
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
            logger.debug("Rate limit exceeded for OpenAI, skipping request");
            return null;
        }

        try {
            String requestJson = objectMapper.writeValueAsString(buildRequest(systemPrompt, userPrompt, jsonResponse));

            String response = webClient.post()
                .uri(apiUrl)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .bodyValue(requestJson)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();

            return parseResponse(response);
        } catch (Exception e) {
            logger.warn("OpenAI provider error: {}", e.getMessage());
            return null;
        }
    }

    Map<String, Object> buildRequest(String systemPrompt, String userPrompt, boolean jsonResponse) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("temperature", 0.3);
        requestBody.put("messages", List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userPrompt)));
        if (jsonResponse) {
            requestBody.put("response_format", Map.of("type", "json_object"));
        }
        return requestBody;
    }

    String parseResponse(String response) {
        if (response == null || response.isEmpty()) {
            return null;
        }
        try {
            JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
            return content.isTextual() ? content.asText().trim() : null;
        } catch (Exception e) {
            logger.warn("Error parsing OpenAI response: {}", e.getMessage());
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
