package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Directed edge between two formulas. Identity is the ordered (from, to) pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormulaDependency {
    private String from;
    private String to;
    private DependencyType type;
    private List<String> sharedVariables;
    private String description;
}
