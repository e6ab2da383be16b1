package com.example.formulamap.dto.diagram;

import com.example.formulamap.dto.formula.FormulaRole;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramNode {
    String id;
    String label;
    NodeShape shape;
    FormulaRole role;
    String fillColor;
    String strokeColor;
}
