package com.example.formulamap.dto;

import com.example.formulamap.dto.diagram.DiagramDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-request options for the formula pipeline.
 * A null {@code maxDependencyInferenceSize} falls back to the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionOptions {
    @Builder.Default
    private boolean includeInline = true;
    @Builder.Default
    private boolean numberedOnly = false;
    private String filterSection;
    private List<String> filterSymbols;
    private Integer maxDependencyInferenceSize;
    @Builder.Default
    private DiagramDirection direction = DiagramDirection.TB;
    @Builder.Default
    private VariableOutputFormat variableOutputFormat = VariableOutputFormat.MERMAID;
    @Builder.Default
    private boolean useAiInference = true;

    public static ExtractionOptions defaults() {
        return ExtractionOptions.builder().build();
    }
}
