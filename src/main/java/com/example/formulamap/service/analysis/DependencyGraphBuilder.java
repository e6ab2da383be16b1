package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.ai.RelationshipInferenceResult;
import com.example.formulamap.dto.ai.RelationshipProposal;
import com.example.formulamap.dto.formula.DependencyType;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.Variable;
import com.example.formulamap.service.ai.RelationshipInferenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the directed dependency edges between formulas.
 *
 * Two formulas that mention the same symbol are linked from the earlier to the later
 * one. When an inference service is available and the formula set is small enough,
 * its proposals are added for pairs that are not linked yet.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    @Autowired(required = false)
    private RelationshipInferenceService relationshipInferenceService;

    @Value("${formula.dependency.max-inference-size:20}")
    private int maxInferenceSize = 20;

    public List<FormulaDependency> build(List<Formula> formulas, boolean useInference, Integer maxInferenceOverride) {
        Map<String, FormulaDependency> edges = new LinkedHashMap<>();

        addSharedVariableEdges(formulas, edges);
        logger.debug("Shared-variable rule produced {} edges", edges.size());

        int limit = maxInferenceOverride != null ? maxInferenceOverride : maxInferenceSize;
        if (useInference && relationshipInferenceService != null && !formulas.isEmpty() && formulas.size() <= limit) {
            mergeInferredEdges(formulas, edges);
        } else if (useInference && formulas.size() > limit) {
            logger.debug("Skipping relationship inference: {} formulas exceeds limit {}", formulas.size(), limit);
        }

        return new ArrayList<>(edges.values());
    }

    private void addSharedVariableEdges(List<Formula> formulas, Map<String, FormulaDependency> edges) {
        // symbol -> indices of formulas using it, in document order
        Map<String, List<Integer>> usersBySymbol = new LinkedHashMap<>();
        for (int i = 0; i < formulas.size(); i++) {
            Set<String> seen = new HashSet<>();
            for (Variable variable : formulas.get(i).getVariables()) {
                if (seen.add(variable.getSymbol())) {
                    usersBySymbol.computeIfAbsent(variable.getSymbol(), k -> new ArrayList<>()).add(i);
                }
            }
        }

        for (Map.Entry<String, List<Integer>> entry : usersBySymbol.entrySet()) {
            List<Integer> users = entry.getValue();
            if (users.size() < 2) {
                continue;
            }
            for (int a = 0; a < users.size(); a++) {
                for (int b = a + 1; b < users.size(); b++) {
                    String from = formulas.get(users.get(a)).getId();
                    String to = formulas.get(users.get(b)).getId();
                    FormulaDependency edge = edges.computeIfAbsent(key(from, to),
                        k -> new FormulaDependency(from, to, DependencyType.USES_VARIABLE, new ArrayList<>(), null));
                    if (!edge.getSharedVariables().contains(entry.getKey())) {
                        edge.getSharedVariables().add(entry.getKey());
                    }
                }
            }
        }

        for (FormulaDependency edge : edges.values()) {
            edge.setDescription("Shares " + String.join(", ", edge.getSharedVariables()));
        }
    }

    private void mergeInferredEdges(List<Formula> formulas, Map<String, FormulaDependency> edges) {
        RelationshipInferenceResult result;
        try {
            result = relationshipInferenceService.inferRelationships(formulas);
        } catch (Exception e) {
            logger.warn("Relationship inference failed: {}", e.getMessage());
            return;
        }

        if (result == null || !result.isSuccess()) {
            logger.warn("Relationship inference unavailable: {}", result != null ? result.getError() : "no result");
            return;
        }

        Set<String> ids = new LinkedHashSet<>();
        formulas.forEach(f -> ids.add(f.getId()));

        int added = 0;
        for (RelationshipProposal proposal : result.getProposals()) {
            if (!ids.contains(proposal.getFrom()) || !ids.contains(proposal.getTo())
                || proposal.getFrom().equals(proposal.getTo())) {
                logger.debug("Dropping proposal with unknown endpoints: {} -> {}", proposal.getFrom(), proposal.getTo());
                continue;
            }
            Optional<DependencyType> type = DependencyType.parse(proposal.getType());
            if (type.isEmpty()) {
                logger.debug("Dropping proposal with unknown type: {}", proposal.getType());
                continue;
            }
            String key = key(proposal.getFrom(), proposal.getTo());
            if (edges.containsKey(key)) {
                continue;
            }
            edges.put(key, new FormulaDependency(proposal.getFrom(), proposal.getTo(), type.get(),
                new ArrayList<>(), proposal.getDescription()));
            added++;
        }
        logger.info("Merged {} inferred relationships", added);
    }

    private static String key(String from, String to) {
        return from + "->" + to;
    }
}
