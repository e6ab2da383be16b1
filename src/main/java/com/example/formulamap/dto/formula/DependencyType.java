package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Kind of relationship between two formulas.
 */
public enum DependencyType {
    USES_VARIABLE("uses_variable"),
    DERIVES_FROM("derives_from"),
    SUBSTITUTES("substitutes"),
    COMBINES("combines");

    private final String value;

    DependencyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup for values coming back from a language model.
     */
    public static Optional<DependencyType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase().replace('-', '_').replace(' ', '_');
        for (DependencyType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
