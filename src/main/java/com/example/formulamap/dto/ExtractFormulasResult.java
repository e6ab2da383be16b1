package com.example.formulamap.dto;

import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.FormulaType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractFormulasResult {
    private boolean success;
    private String paperTitle;
    private List<Formula> formulas = new ArrayList<>();
    private Stats stats = Stats.of(List.of());
    private String error;

    public static ExtractFormulasResult success(String paperTitle, List<Formula> formulas) {
        return new ExtractFormulasResult(true, paperTitle, formulas, Stats.of(formulas), null);
    }

    public static ExtractFormulasResult failure(String error) {
        return new ExtractFormulasResult(false, "", new ArrayList<>(), Stats.of(List.of()), error);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private int totalFormulas;
        private int numberedEquations;
        private int inlineFormulas;
        private Map<String, Integer> byRole = new LinkedHashMap<>();

        /**
         * Counts every role of the vocabulary, so byRole always sums to totalFormulas.
         */
        public static Stats of(List<Formula> formulas) {
            Map<String, Integer> byRole = new LinkedHashMap<>();
            for (FormulaRole role : FormulaRole.values()) {
                byRole.put(role.getValue(), 0);
            }
            int numbered = 0;
            int inline = 0;
            for (Formula formula : formulas) {
                byRole.merge(formula.getRole().getValue(), 1, Integer::sum);
                if (formula.getNumber() != null) {
                    numbered++;
                }
                if (formula.getType() == FormulaType.INLINE) {
                    inline++;
                }
            }
            return new Stats(formulas.size(), numbered, inline, byRole);
        }
    }
}
