package com.example.formulamap.dto;

import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.formula.VariableUsage;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariableAnalysisResult {
    private boolean success;
    private List<VariableUsage> variables = new ArrayList<>();
    private Stats stats = new Stats();
    private DiagramGraph graph;
    private String mermaid;
    private String markdown;
    private String table;
    private String error;

    public static VariableAnalysisResult failure(String error) {
        VariableAnalysisResult result = new VariableAnalysisResult();
        result.setSuccess(false);
        result.setError(error);
        return result;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private int totalVariables;
        private int definedVariables;
        private int undefinedVariables;
        private List<String> mostUsedVariables = new ArrayList<>();
    }
}
