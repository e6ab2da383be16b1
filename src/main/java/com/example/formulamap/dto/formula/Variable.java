package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A symbol as it occurs inside one formula.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Variable {
    private String symbol;
    private String latex;
    private String meaning;
    private VariableType type;
    private String definedIn;

    public Variable(String symbol, String latex, VariableType type) {
        this.symbol = symbol;
        this.latex = latex;
        this.type = type;
    }
}
