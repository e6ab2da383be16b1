package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VariableType {
    SCALAR("scalar"),
    VECTOR("vector"),
    MATRIX("matrix"),
    TENSOR("tensor"),
    FUNCTION("function"),
    SET("set"),
    UNKNOWN("unknown");

    private final String value;

    VariableType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
