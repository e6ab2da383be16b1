package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.DocumentText;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks a paper title: source metadata when present, otherwise the best scoring
 * line among the first lines before the abstract.
 */
@Component
public class PaperTitleExtractor {

    static final String UNTITLED = "Untitled Paper";

    public String extractTitle(DocumentText document) {
        if (document == null) {
            return UNTITLED;
        }
        if (document.getTitle() != null && document.getTitle().trim().length() > 5) {
            return document.getTitle().trim();
        }
        if (document.isBlank()) {
            return UNTITLED;
        }

        List<String> lines = Arrays.stream(document.getText().split("\n"))
            .map(l -> l.replace('\f', ' ').trim())
            .filter(l -> !l.isEmpty())
            .limit(15)
            .collect(Collectors.toList());

        String title = "";
        int maxScore = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.toLowerCase().contains("abstract")) {
                break;
            }

            int score = 0;
            score += line.length() > 20 && line.length() < 150 ? 10 : 0;
            score += Character.isUpperCase(line.charAt(0)) ? 5 : 0;
            score += i < 5 ? 5 - i : 0;
            score -= line.contains("@") ? 10 : 0;
            score -= Character.isDigit(line.charAt(0)) ? 5 : 0;
            score -= line.contains("$") ? 5 : 0;

            if (score > maxScore) {
                maxScore = score;
                title = line;
            }
        }

        return title.isEmpty() ? UNTITLED : title;
    }
}
