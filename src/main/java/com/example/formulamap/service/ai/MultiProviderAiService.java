package com.example.formulamap.service.ai;

import com.example.formulamap.dto.ai.RelationshipInferenceResult;
import com.example.formulamap.dto.ai.RelationshipProposal;
import com.example.formulamap.dto.formula.Formula;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-provider AI service with automatic fallback.
 * Tries providers in priority order until one returns a usable answer.
 */
@Service
public class MultiProviderAiService implements RelationshipInferenceService, RoleFlowDescriptionService {

    private static final Logger logger = LoggerFactory.getLogger(MultiProviderAiService.class);

    @Autowired(required = false)
    private List<FormulaAiProvider> providers;

    @Autowired
    private FormulaPromptBuilder promptBuilder;

    @Value("${ai.provider.fallback.log.enabled:true}")
    private boolean logFallback = true;

    @Value("${ai.provider.test-on-startup:true}")
    private boolean testOnStartup = true;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private List<FormulaAiProvider> sortedProviders = new ArrayList<>();
    private final AtomicInteger requestCounter = new AtomicInteger(0);
    private final AtomicInteger fallbackCounter = new AtomicInteger(0);

    @PostConstruct
    public void initialize() {
        if (providers == null || providers.isEmpty()) {
            logger.warn("⚠️ No AI providers found. Relationship inference and flow descriptions are disabled.");
            sortedProviders = new ArrayList<>();
            return;
        }

        sortedProviders = new ArrayList<>(providers);
        sortedProviders.sort(Comparator.comparingInt(FormulaAiProvider::getPriority));

        logger.info("🤖 Multi-Provider AI Service initialized with {} providers:", sortedProviders.size());
        for (FormulaAiProvider provider : sortedProviders) {
            String status = provider.isEnabled() ? "✅" : "❌";
            logger.info("   {} {} (priority: {})", status, provider.getName(), provider.getPriority());
        }

        if (testOnStartup) {
            testAllProviders();
        }
    }

    @Override
    public RelationshipInferenceResult inferRelationships(List<Formula> formulas) {
        if (formulas == null || formulas.size() < 2) {
            return RelationshipInferenceResult.skipped();
        }
        if (!hasAvailableProvider()) {
            return RelationshipInferenceResult.failure("No AI provider available");
        }

        String answer = ask(promptBuilder.relationSystemPrompt(), promptBuilder.relationPrompt(formulas), true);
        if (answer == null) {
            return RelationshipInferenceResult.failure("All AI providers failed to infer relationships");
        }

        try {
            return RelationshipInferenceResult.success(parseProposals(answer));
        } catch (Exception e) {
            logger.warn("Could not parse relationship answer: {}", e.getMessage());
            return RelationshipInferenceResult.failure("Unreadable relationship answer: " + e.getMessage());
        }
    }

    @Override
    public Optional<String> describeLogicalFlow(List<Formula> formulas) {
        if (formulas == null || formulas.size() < 2 || !hasAvailableProvider()) {
            return Optional.empty();
        }
        String answer = ask(promptBuilder.flowSystemPrompt(), promptBuilder.flowPrompt(formulas), false);
        return Optional.ofNullable(answer).filter(a -> !a.isBlank());
    }

    /**
     * Returns the first non-empty answer in priority order, or null.
     */
    String ask(String systemPrompt, String userPrompt, boolean jsonResponse) {
        requestCounter.incrementAndGet();
        int topPriority = sortedProviders.isEmpty() ? 0 : sortedProviders.get(0).getPriority();

        for (FormulaAiProvider provider : sortedProviders) {
            if (!provider.isEnabled() || !provider.isAvailable()) {
                continue;
            }
            boolean fallback = provider.getPriority() > topPriority;
            try {
                if (logFallback && fallback) {
                    logger.debug("Trying fallback provider: {}", provider.getName());
                }
                String answer = provider.complete(systemPrompt, userPrompt, jsonResponse);
                if (answer != null && !answer.trim().isEmpty()) {
                    if (logFallback && fallback) {
                        logger.info("✅ Fallback provider {} succeeded", provider.getName());
                        fallbackCounter.incrementAndGet();
                    }
                    return answer;
                }
            } catch (Exception e) {
                logger.debug("Provider {} failed: {}", provider.getName(), e.getMessage());
            }
        }

        logger.warn("⚠️ All AI providers failed to answer");
        return null;
    }

    List<RelationshipProposal> parseProposals(String answer) throws Exception {
        JsonNode root = objectMapper.readTree(stripCodeFence(answer));
        JsonNode dependencies = root.isArray() ? root : root.path("dependencies");

        List<RelationshipProposal> proposals = new ArrayList<>();
        if (!dependencies.isArray()) {
            return proposals;
        }
        for (JsonNode node : dependencies) {
            String from = node.path("from").asText(null);
            String to = node.path("to").asText(null);
            if (from == null || to == null) {
                continue;
            }
            proposals.add(new RelationshipProposal(from, to, node.path("type").asText(null),
                node.path("description").asText(null)));
        }
        return proposals;
    }

    private static String stripCodeFence(String answer) {
        String trimmed = answer.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private void testAllProviders() {
        logger.info("🔍 Testing AI provider connections...");
        for (FormulaAiProvider provider : sortedProviders) {
            if (!provider.isEnabled()) {
                continue;
            }
            try {
                boolean working = provider.testConnection();
                logger.info("   {} - {}", working ? "✅ WORKING" : "❌ FAILED", provider.getName());
            } catch (Exception e) {
                logger.warn("   ❌ ERROR - {}: {}", provider.getName(), e.getMessage());
            }
        }
    }

    public boolean hasAvailableProvider() {
        return sortedProviders.stream().anyMatch(p -> p.isEnabled() && p.isAvailable());
    }

    public List<FormulaAiProvider> getSortedProviders() {
        return List.copyOf(sortedProviders);
    }

    public String getStatistics() {
        if (sortedProviders.isEmpty()) {
            return "No providers configured";
        }
        StringBuilder stats = new StringBuilder();
        stats.append("Total requests: ").append(requestCounter.get()).append("\n");
        stats.append("Fallback usage: ").append(fallbackCounter.get()).append("\n");
        stats.append("Providers:\n");
        for (FormulaAiProvider provider : sortedProviders) {
            stats.append("  - ").append(provider.getName())
                .append(": ").append(provider.isEnabled() ? "enabled" : "disabled")
                .append(" (priority: ").append(provider.getPriority()).append(")\n");
        }
        return stats.toString();
    }
}
