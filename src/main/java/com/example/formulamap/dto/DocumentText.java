package com.example.formulamap.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain text of a document as produced by a text source.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DocumentText {
    private String title;
    private String text;
    private Integer pageCount;
    private List<String> sectionHints = new ArrayList<>();

    public DocumentText(String text) {
        this.text = text;
    }

    public boolean isBlank() {
        return text == null || text.trim().isEmpty();
    }
}
