package com.example.formulamap.dto;

import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
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
public class RoleAnalysisResult {
    private boolean success;
    private Map<String, List<Formula>> roleGroups = new LinkedHashMap<>();
    private DiagramGraph flowGraph;
    private String mermaid;
    private String markdown;
    private Analysis analysis = new Analysis();
    private String error;

    public static RoleAnalysisResult failure(String error) {
        RoleAnalysisResult result = new RoleAnalysisResult();
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
        private List<FormulaRole> dominantRoles = new ArrayList<>();
        private String logicalFlow = "";
    }
}
