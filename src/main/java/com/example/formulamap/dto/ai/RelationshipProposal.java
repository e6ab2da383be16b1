package com.example.formulamap.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Edge suggested by a relationship-inference service. The type is kept as raw text
 * until it is merged into the dependency graph.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipProposal {
    private String from;
    private String to;
    private String type;
    private String description;
}
