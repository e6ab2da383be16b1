package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FormulaType {
    EQUATION("equation"),     // numbered display formula
    INLINE("inline"),
    DISPLAY("display"),       // display formula without a number
    DEFINITION("definition"); // display formula written with := or \triangleq

    private final String value;

    FormulaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
