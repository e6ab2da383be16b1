package com.example.formulamap.dto.diagram;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramEdge {
    String from;
    String to;
    String label;
    EdgeStyle style;
    EdgeArrow arrow;
}
