package com.example.formulamap.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Logs which AI providers are configured. Both are reached over their REST APIs,
 * so no client library is needed.
 */
@Configuration
public class AiProviderConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AiProviderConfiguration.class);

    @Value("${ai.provider.openai.enabled:true}")
    private boolean openAiEnabled;

    @Value("${ai.provider.openai.api.key:}")
    private String openAiKey;

    @Value("${ai.provider.openai.model:gpt-4o}")
    private String openAiModel;

    @Value("${ai.provider.gemini.enabled:true}")
    private boolean geminiEnabled;

    @Value("${ai.provider.gemini.api.key:}")
    private String geminiKey;

    @Value("${ai.provider.gemini.model:gemini-2.5-flash}")
    private String geminiModel;

    @Value("${formula.dependency.max-inference-size:20}")
    private int maxInferenceSize;

    @PostConstruct
    public void initialize() {
        logProvider("OpenAI", openAiEnabled, openAiKey, openAiModel);
        logProvider("Gemini", geminiEnabled, geminiKey, geminiModel);
        logger.info("   - Relationship inference for up to {} formulas", maxInferenceSize);
    }

    private static void logProvider(String name, boolean enabled, String apiKey, String model) {
        if (enabled && apiKey != null && !apiKey.isEmpty()) {
            logger.info("✅ {} provider configured (REST API)", name);
            logger.info("   - Model: {}", model);
            logger.info("   - API Key: {}", mask(apiKey));
        } else {
            logger.info("ℹ️ {} provider is disabled or not configured", name);
        }
    }

    static String mask(String apiKey) {
        if (apiKey.length() <= 8) {
            return "****";
        }
        return apiKey.substring(0, 4) + "..." + apiKey.substring(apiKey.length() - 4);
    }
}
