package com.example.formulamap.service.diagram;

import com.example.formulamap.dto.formula.VariableUsage;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Markdown table of variable usages: symbol, markup, definitions, uses, first section.
 */
@Component
public class VariableTableFormatter {

    private static final int MAX_REFERENCES = 3;

    public String format(List<VariableUsage> variables) {
        StringBuilder table = new StringBuilder();
        table.append("| Symbol | LaTeX | Defined in | Used in | First appearance |\n");
        table.append("|--------|-------|------------|---------|------------------|");

        for (VariableUsage v : variables) {
            String definedIn = v.getDefinedIn().isEmpty() ? "-" : String.join(", ", head(v.getDefinedIn()));
            String usedIn = String.join(", ", head(v.getUsedIn()))
                + (v.getUsedIn().size() > MAX_REFERENCES ? "..." : "");
            table.append('\n')
                .append("| ").append(cell(v.getSymbol()))
                .append(" | `").append(cell(v.getLatex())).append('`')
                .append(" | ").append(definedIn)
                .append(" | ").append(usedIn)
                .append(" | ").append(cell(v.getFirstAppearance()))
                .append(" |");
        }
        return table.toString();
    }

    private static List<String> head(List<String> ids) {
        return ids.subList(0, Math.min(MAX_REFERENCES, ids.size()));
    }

    private static String cell(String value) {
        return value == null ? "" : value.replace("|", "\\|");
    }
}
