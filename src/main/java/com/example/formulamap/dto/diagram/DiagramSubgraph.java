package com.example.formulamap.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class DiagramSubgraph {
    String id;
    String label;
    List<String> nodes;
}
