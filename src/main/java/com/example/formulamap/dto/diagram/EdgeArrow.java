package com.example.formulamap.dto.diagram;

public enum EdgeArrow {
    NORMAL,
    NONE,
    BOTH
}
