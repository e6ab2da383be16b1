package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.service.ai.RoleFlowDescriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Groups formulas by role and summarizes how the roles follow each other.
 */
@Service
public class RoleAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(RoleAnalysisService.class);

    static final int DOMINANT_ROLE_LIMIT = 3;

    static final String NO_FLOW_DESCRIPTION = "The formula structure of this paper could not be characterized.";

    private static final Map<FormulaRole, String> ROLE_PHRASES = new EnumMap<>(FormulaRole.class);

    static {
        ROLE_PHRASES.put(FormulaRole.DEFINITION, "defines its basic concepts and variables");
        ROLE_PHRASES.put(FormulaRole.OBJECTIVE, "sets up the objective to optimize");
        ROLE_PHRASES.put(FormulaRole.CONSTRAINT, "states the constraints");
        ROLE_PHRASES.put(FormulaRole.THEOREM, "presents its main theorems and results");
        ROLE_PHRASES.put(FormulaRole.DERIVATION, "derives and expands formulas");
        ROLE_PHRASES.put(FormulaRole.APPROXIMATION, "performs approximations and estimates");
        ROLE_PHRASES.put(FormulaRole.EXAMPLE, "gives concrete examples");
        ROLE_PHRASES.put(FormulaRole.BASELINE, "compares against existing methods");
    }

    @Autowired(required = false)
    private RoleFlowDescriptionService roleFlowDescriptionService;

    /**
     * All nine roles, in vocabulary order, each mapped to its formulas (possibly none).
     */
    public Map<FormulaRole, List<Formula>> group(List<Formula> formulas) {
        Map<FormulaRole, List<Formula>> groups = new LinkedHashMap<>();
        for (FormulaRole role : FormulaRole.values()) {
            groups.put(role, new ArrayList<>());
        }
        for (Formula formula : formulas) {
            groups.get(formula.getRole()).add(formula);
        }
        return groups;
    }

    public List<FormulaRole> dominantRoles(Map<FormulaRole, List<Formula>> groups) {
        return groups.entrySet().stream()
            .filter(e -> !e.getValue().isEmpty())
            .sorted(Comparator.comparingInt((Map.Entry<FormulaRole, List<Formula>> e) -> e.getValue().size())
                .reversed())
            .limit(DOMINANT_ROLE_LIMIT)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    /**
     * Asks the description service when there are at least two formulas, and falls
     * back to a sentence built from the dominant roles.
     */
    public String logicalFlow(List<Formula> formulas, List<FormulaRole> dominantRoles, boolean useAi) {
        if (useAi && roleFlowDescriptionService != null && formulas.size() >= 2) {
            try {
                Optional<String> described = roleFlowDescriptionService.describeLogicalFlow(formulas);
                if (described.isPresent() && !described.get().isBlank()) {
                    return described.get().trim();
                }
                logger.debug("Role flow description was empty, using default text");
            } catch (Exception e) {
                logger.warn("Role flow description failed: {}", e.getMessage());
            }
        }
        return defaultFlowDescription(dominantRoles);
    }

    static String defaultFlowDescription(List<FormulaRole> dominantRoles) {
        List<String> phrases = dominantRoles.stream()
            .map(ROLE_PHRASES::get)
            .filter(p -> p != null)
            .collect(Collectors.toList());

        if (phrases.isEmpty()) {
            return NO_FLOW_DESCRIPTION;
        }
        if (phrases.size() == 1) {
            return "This paper mainly " + phrases.get(0) + ".";
        }
        String head = String.join(", ", phrases.subList(0, phrases.size() - 1));
        return "This paper mainly " + head + " and " + phrases.get(phrases.size() - 1) + ".";
    }
}
