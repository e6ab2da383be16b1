package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rhetorical role of a formula within a paper.
 * Declaration order is the vocabulary order used for role buckets and clusters.
 */
public enum FormulaRole {
    DEFINITION("definition", "Definition", "#e3f2fd"),
    OBJECTIVE("objective", "Objective", "#fff3e0"),
    CONSTRAINT("constraint", "Constraint", "#fce4ec"),
    THEOREM("theorem", "Theorem", "#e8f5e9"),
    DERIVATION("derivation", "Derivation", "#f3e5f5"),
    APPROXIMATION("approximation", "Approximation", "#fff8e1"),
    EXAMPLE("example", "Example", "#f5f5f5"),
    BASELINE("baseline", "Baseline", "#eceff1"),
    UNKNOWN("unknown", "Unknown", "#ffffff");

    private final String value;
    private final String label;
    private final String color;

    FormulaRole(String value, String label, String color) {
        this.value = value;
        this.label = label;
        this.color = color;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }

    @JsonCreator
    public static FormulaRole fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (FormulaRole role : values()) {
            if (role.value.equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        return UNKNOWN;
    }
}
