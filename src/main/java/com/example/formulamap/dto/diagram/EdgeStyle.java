package com.example.formulamap.dto.diagram;

public enum EdgeStyle {
    SOLID,
    DOTTED,
    THICK
}
