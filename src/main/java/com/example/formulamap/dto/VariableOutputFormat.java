package com.example.formulamap.dto;

public enum VariableOutputFormat {
    MERMAID,
    TABLE,
    JSON;

    public static VariableOutputFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return MERMAID;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MERMAID;
        }
    }
}
