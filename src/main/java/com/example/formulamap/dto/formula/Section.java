package com.example.formulamap.dto.formula;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contiguous span of document text under one heading.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Section {
    private String id;
    private String name;         // display label, e.g. "서론 (Introduction)"
    private String originalName; // heading as written in the document
    private String content;
    private int[] pageRange;     // [start, end], 1-based

    public int getStartPage() {
        return pageRange != null && pageRange.length > 0 ? pageRange[0] : 1;
    }
}
