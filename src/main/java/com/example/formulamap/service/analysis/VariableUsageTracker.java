package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.VariableAnalysisResult;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.Variable;
import com.example.formulamap.dto.formula.VariableUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregates, per symbol, the formulas that define it and the formulas that use it.
 */
@Service
public class VariableUsageTracker {

    private static final Logger logger = LoggerFactory.getLogger(VariableUsageTracker.class);

    private static final int MOST_USED_LIMIT = 5;

    /**
     * Returns one usage per symbol in order of first appearance.
     */
    public List<VariableUsage> track(List<Formula> formulas) {
        Map<String, VariableUsage> usages = new LinkedHashMap<>();

        for (Formula formula : formulas) {
            for (Variable variable : formula.getVariables()) {
                VariableUsage usage = usages.computeIfAbsent(variable.getSymbol(), symbol -> {
                    VariableUsage created = new VariableUsage();
                    created.setSymbol(symbol);
                    created.setLatex(variable.getLatex());
                    created.setMeaning(variable.getMeaning());
                    created.setFirstAppearance(formula.getSection());
                    return created;
                });

                if (formula.getRole() == FormulaRole.DEFINITION && !usage.getDefinedIn().contains(formula.getId())) {
                    usage.getDefinedIn().add(formula.getId());
                }
                if (!usage.getUsedIn().contains(formula.getId())) {
                    usage.getUsedIn().add(formula.getId());
                }
                if (usage.getMeaning() == null && variable.getMeaning() != null) {
                    usage.setMeaning(variable.getMeaning());
                }
            }
        }

        logger.debug("Tracked {} distinct symbols over {} formulas", usages.size(), formulas.size());
        return new ArrayList<>(usages.values());
    }

    /**
     * Keeps only the listed symbols; a null or empty filter keeps everything.
     * Matching is on the symbol or on its markup.
     */
    public List<VariableUsage> filterSymbols(List<VariableUsage> usages, List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return usages;
        }
        Set<String> wanted = new HashSet<>();
        for (String symbol : symbols) {
            if (symbol != null && !symbol.isBlank()) {
                wanted.add(symbol.trim());
            }
        }
        return usages.stream()
            .filter(u -> wanted.contains(u.getSymbol()) || wanted.contains(u.getLatex()))
            .collect(Collectors.toList());
    }

    public VariableAnalysisResult.Stats stats(List<VariableUsage> usages) {
        int defined = (int) usages.stream().filter(VariableUsage::isDefined).count();

        // stable sort keeps first-appearance order among equal counts
        List<String> mostUsed = usages.stream()
            .sorted(Comparator.comparingInt((VariableUsage u) -> u.getUsedIn().size()).reversed())
            .limit(MOST_USED_LIMIT)
            .map(VariableUsage::getSymbol)
            .collect(Collectors.toList());

        return new VariableAnalysisResult.Stats(usages.size(), defined, usages.size() - defined, mostUsed);
    }
}
