package com.example.formulamap.dto.diagram;

/**
 * Layout direction hint for the drawing step.
 */
public enum DiagramDirection {
    TB,
    BT,
    LR,
    RL;

    public static DiagramDirection fromString(String value, DiagramDirection fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
