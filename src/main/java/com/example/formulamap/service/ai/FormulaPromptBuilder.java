package com.example.formulamap.service.ai;

import com.example.formulamap.dto.formula.Formula;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts sent to the language model providers.
 */
@Component
public class FormulaPromptBuilder {

    static final int MAX_RELATION_FORMULAS = 20;
    static final int RELATION_LATEX_LENGTH = 100;
    static final int MAX_FLOW_FORMULAS = 30;
    static final int FLOW_LATEX_LENGTH = 80;

    static final String RELATION_SYSTEM_PROMPT = "You are an expert at analyzing mathematical formula dependencies.";
    static final String FLOW_SYSTEM_PROMPT = "You are an expert at understanding the logical structure of mathematical papers.";

    public String relationSystemPrompt() {
        return RELATION_SYSTEM_PROMPT;
    }

    public String flowSystemPrompt() {
        return FLOW_SYSTEM_PROMPT;
    }

    public String relationPrompt(List<Formula> formulas) {
        String formulaList = formulas.stream()
            .limit(MAX_RELATION_FORMULAS)
            .map(f -> "- " + f.getId() + ": " + shorten(f.getLatex(), RELATION_LATEX_LENGTH)
                + " (" + f.getRole().getValue() + ")")
            .collect(Collectors.joining("\n"));

        return "Analyze dependencies between these formulas:\n\n"
            + formulaList + "\n\n"
            + "Identify which formulas depend on others (uses variables defined in, derived from, substitutes into, combines).\n"
            + "Use only the formula ids listed above. Allowed types: uses_variable, derives_from, substitutes, combines.\n\n"
            + "Return JSON:\n"
            + "{\n"
            + "  \"dependencies\": [\n"
            + "    {\"from\": \"eq1\", \"to\": \"eq2\", \"type\": \"uses_variable\", \"description\": \"eq2 uses variable x defined in eq1\"}\n"
            + "  ]\n"
            + "}";
    }

    public String flowPrompt(List<Formula> formulas) {
        String formulaList = formulas.stream()
            .limit(MAX_FLOW_FORMULAS)
            .map(f -> "- " + f.getId() + " [" + f.getRole().getValue() + "]: " + shorten(f.getLatex(), FLOW_LATEX_LENGTH))
            .collect(Collectors.joining("\n"));

        return "Analyze the logical flow of these formulas in the paper:\n\n"
            + formulaList + "\n\n"
            + "Describe how the formulas build upon each other:\n"
            + "1. What definitions are established first?\n"
            + "2. What is the main objective/theorem?\n"
            + "3. How do derivations connect them?\n\n"
            + "Return a concise paragraph (3-5 sentences) describing the logical flow.";
    }

    private static String shorten(String latex, int length) {
        if (latex == null) {
            return "";
        }
        return latex.length() > length ? latex.substring(0, length) + "..." : latex;
    }
}
