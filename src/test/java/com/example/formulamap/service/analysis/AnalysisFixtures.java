package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.FormulaType;
import com.example.formulamap.dto.formula.Variable;
import com.example.formulamap.dto.formula.VariableType;

import java.util.ArrayList;
import java.util.List;

final class AnalysisFixtures {

    private AnalysisFixtures() {
    }

    static Formula formula(String id, FormulaRole role, String... symbols) {
        List<Variable> variables = new ArrayList<>();
        for (String symbol : symbols) {
            variables.add(new Variable(symbol, symbol, VariableType.SCALAR));
        }
        return Formula.builder()
            .id(id)
            .latex(id + " markup")
            .type(FormulaType.DISPLAY)
            .role(role)
            .section("Method")
            .variables(variables)
            .build();
    }
}
