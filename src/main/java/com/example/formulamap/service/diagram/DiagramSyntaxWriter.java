package com.example.formulamap.service.diagram;

import com.example.formulamap.dto.diagram.DiagramGraph;

/**
 * Turns a {@link DiagramGraph} into the text of a concrete diagram language.
 */
public interface DiagramSyntaxWriter {

    String getName();

    String write(DiagramGraph graph);

    /**
     * Embeds written diagram text in a markdown document.
     */
    String wrapInMarkdown(String diagram);
}
