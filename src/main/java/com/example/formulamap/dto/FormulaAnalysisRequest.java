package com.example.formulamap.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormulaAnalysisRequest {
    private String title;
    private String text;
    private List<String> sectionHints = new ArrayList<>();
    private ExtractionOptions options;

    public DocumentText toDocumentText() {
        DocumentText document = new DocumentText(text);
        document.setTitle(title);
        if (sectionHints != null) {
            document.setSectionHints(sectionHints);
        }
        return document;
    }
}
