package com.example.formulamap.dto.diagram;

public enum NodeShape {
    RECTANGLE,
    ROUNDED,
    CIRCLE,
    DIAMOND,
    HEXAGON,
    STADIUM
}
