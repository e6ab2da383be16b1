package com.example.formulamap.service.ai;

/**
 * A hosted language model that can answer formula-analysis prompts.
 */
public interface FormulaAiProvider {

    /**
     * Get the name of this provider
     */
    String getName();

    /**
     * Enabled by configuration and holding credentials
     */
    boolean isEnabled();

    /**
     * Sends one chat turn and returns the model's text.
     *
     * @param systemPrompt instructions for the model
     * @param userPrompt the actual request
     * @param jsonResponse ask the model for a JSON object instead of prose
     * @return the answer, or null when the call failed or was rate limited
     */
    String complete(String systemPrompt, String userPrompt, boolean jsonResponse);

    boolean testConnection();

    /**
     * Lower number = tried first
     */
    int getPriority();

    /**
     * False while the provider's request quota is used up
     */
    boolean isAvailable();
}
