package com.example.formulamap.dto;

import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.formula.FormulaCluster;
import com.example.formulamap.dto.formula.FormulaDependency;
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
public class DependencyAnalysisResult {
    private boolean success;
    private Analysis analysis = new Analysis();
    private List<FormulaDependency> dependencies = new ArrayList<>();
    private DiagramGraph graph;
    private String mermaid;
    private String markdown;
    private String error;

    public static DependencyAnalysisResult failure(String error) {
        DependencyAnalysisResult result = new DependencyAnalysisResult();
        result.setSuccess(false);
        result.setMermaid("");
        result.setMarkdown("");
        result.setError(error);
        return result;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Analysis {
        private int totalFormulas;
        private int totalDependencies;
        private List<String> rootFormulas = new ArrayList<>();
        private List<String> leafFormulas = new ArrayList<>();
        private List<FormulaCluster> clusters = new ArrayList<>();
    }
}
