package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.DocumentText;
import com.example.formulamap.dto.formula.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the plain text of a paper into named sections.
 * Headings are detected line by line: numbered headings ("3. Method", "2.1 Setup"),
 * roman numeral headings ("IV. RESULTS"), canonical section names and section hints
 * supplied by the text source.
 */
@Service
public class SectionSegmentationService {

    private static final Logger logger = LoggerFactory.getLogger(SectionSegmentationService.class);

    static final String PREAMBLE_SECTION = "Header";
    static final String IMPLICIT_SECTION = "Document";

    private static final int MAX_HEADING_LENGTH = 80;
    private static final int MAX_HEADING_WORDS = 8;

    private static final Pattern NUMBERED_HEADING = Pattern.compile(
        "^(\\d{1,2}(?:\\.\\d{1,2})*)\\.?\\s+([A-Z][A-Za-z][A-Za-z\\s\\-:&,]*)$"
    );

    private static final Pattern LATEX_HEADING = Pattern.compile(
        "^\\\\(?:sub){0,2}section\\*?\\{([^{}]+)\\}\\s*$"
    );

    private static final Pattern ROMAN_HEADING = Pattern.compile(
        "^(I{1,3}|IV|V|VI{1,3}|IX|X)\\.\\s+([A-Z][A-Za-z\\s\\-:&,]*)$"
    );

    // Canonical section names with their display labels
    private static final Map<String, String> CANONICAL_SECTIONS = new LinkedHashMap<>();

    static {
        CANONICAL_SECTIONS.put("abstract", "초록 (Abstract)");
        CANONICAL_SECTIONS.put("introduction", "서론 (Introduction)");
        CANONICAL_SECTIONS.put("related work", "관련 연구 (Related Work)");
        CANONICAL_SECTIONS.put("background", "배경 (Background)");
        CANONICAL_SECTIONS.put("preliminaries", "사전 지식 (Preliminaries)");
        CANONICAL_SECTIONS.put("method", "방법론 (Method)");
        CANONICAL_SECTIONS.put("methods", "방법론 (Methods)");
        CANONICAL_SECTIONS.put("methodology", "방법론 (Methodology)");
        CANONICAL_SECTIONS.put("approach", "접근법 (Approach)");
        CANONICAL_SECTIONS.put("model", "모델 (Model)");
        CANONICAL_SECTIONS.put("architecture", "아키텍처 (Architecture)");
        CANONICAL_SECTIONS.put("experiment", "실험 (Experiment)");
        CANONICAL_SECTIONS.put("experiments", "실험 (Experiments)");
        CANONICAL_SECTIONS.put("evaluation", "평가 (Evaluation)");
        CANONICAL_SECTIONS.put("results", "결과 (Results)");
        CANONICAL_SECTIONS.put("discussion", "토의 (Discussion)");
        CANONICAL_SECTIONS.put("conclusion", "결론 (Conclusion)");
        CANONICAL_SECTIONS.put("conclusions", "결론 (Conclusions)");
        CANONICAL_SECTIONS.put("future work", "향후 연구 (Future Work)");
        CANONICAL_SECTIONS.put("acknowledgments", "감사의 글 (Acknowledgments)");
        CANONICAL_SECTIONS.put("acknowledgements", "감사의 글 (Acknowledgements)");
        CANONICAL_SECTIONS.put("references", "참고문헌 (References)");
        CANONICAL_SECTIONS.put("appendix", "부록 (Appendix)");
    }

    @Value("${formula.section.min-content-length:20}")
    private int minContentLength = 20;

    @Value("${formula.section.chars-per-page:3000}")
    private int charsPerPage = 3000;

    public List<Section> segment(String text) {
        return segment(new DocumentText(text));
    }

    /**
     * Segments the document into sections in document order.
     * Returns an empty list for blank input; otherwise at least one section.
     */
    public List<Section> segment(DocumentText document) {
        if (document == null || document.isBlank()) {
            return Collections.emptyList();
        }

        String text = document.getText().replace("\r\n", "\n").replace('\r', '\n');
        boolean hasPageBreaks = text.indexOf('\f') >= 0;
        List<String> hints = document.getSectionHints() != null ? document.getSectionHints() : List.of();

        List<OpenSection> sections = new ArrayList<>();
        Map<String, OpenSection> byName = new HashMap<>();
        StringBuilder allContent = new StringBuilder();
        OpenSection current = null;
        boolean headingSeen = false;
        int page = 1;
        long charCount = 0;

        for (String rawLine : text.split("\n", -1)) {
            if (hasPageBreaks) {
                page += countPageBreaks(rawLine);
            } else {
                charCount += rawLine.length() + 1;
                page = 1 + (int) (charCount / Math.max(1, charsPerPage));
            }

            String line = rawLine.replace('\f', ' ').trim();
            String heading = detectHeading(line, hints);

            if (heading != null) {
                headingSeen = true;
                String key = heading.toLowerCase(Locale.ROOT);
                OpenSection existing = byName.get(key);
                if (existing != null) {
                    // running headers and repeated titles continue the section already opened
                    current = existing;
                    continue;
                }
                current = new OpenSection(heading, page);
                sections.add(current);
                byName.put(key, current);
                logger.debug("Detected section heading '{}' on page {}", heading, page);
                continue;
            }

            if (line.isEmpty()) {
                continue;
            }

            allContent.append(line).append('\n');
            if (current == null) {
                current = new OpenSection(PREAMBLE_SECTION, page);
                sections.add(current);
                byName.put(PREAMBLE_SECTION.toLowerCase(Locale.ROOT), current);
            }
            current.append(line, page);
        }

        if (!headingSeen) {
            logger.debug("No section headings detected, using a single implicit section");
            Section implicit = new Section("section-1", IMPLICIT_SECTION, IMPLICIT_SECTION,
                allContent.toString().trim(), new int[]{1, Math.max(1, page)});
            return List.of(implicit);
        }

        List<Section> result = new ArrayList<>();
        for (OpenSection open : sections) {
            String content = open.content.toString().trim();
            if (content.length() < minContentLength) {
                logger.debug("Discarding short section '{}' ({} chars)", open.originalName, content.length());
                continue;
            }
            result.add(new Section("section-" + (result.size() + 1), toLabel(open.originalName),
                open.originalName, content, new int[]{open.startPage, open.endPage}));
        }

        logger.info("Segmented document into {} sections", result.size());
        return result;
    }

    /**
     * Returns the heading title when the line is a section heading, otherwise null.
     */
    String detectHeading(String line, List<String> hints) {
        if (line.isEmpty() || line.length() >= MAX_HEADING_LENGTH) {
            return null;
        }

        for (String hint : hints) {
            if (hint != null && !hint.isBlank() && line.equalsIgnoreCase(hint.trim())) {
                return stripNumbering(line);
            }
        }

        Matcher latex = LATEX_HEADING.matcher(line);
        if (latex.matches()) {
            return stripNumbering(latex.group(1).trim());
        }

        Matcher numbered = NUMBERED_HEADING.matcher(line);
        if (numbered.matches() && isShortTitle(numbered.group(2))) {
            return numbered.group(2).trim();
        }

        Matcher roman = ROMAN_HEADING.matcher(line);
        if (roman.matches() && isShortTitle(roman.group(2))) {
            return roman.group(2).trim();
        }

        String lower = line.toLowerCase();
        for (String known : CANONICAL_SECTIONS.keySet()) {
            if (lower.equals(known) || lower.startsWith(known + ":")) {
                return line.endsWith(":") ? line.substring(0, line.length() - 1).trim() : line;
            }
        }

        return null;
    }

    /**
     * Maps a heading to its bilingual display label; unknown headings keep their text.
     */
    public static String toLabel(String heading) {
        if (heading == null) {
            return "";
        }
        String lower = heading.toLowerCase().trim();
        int colon = lower.indexOf(':');
        if (colon > 0) {
            lower = lower.substring(0, colon).trim();
        }
        String label = CANONICAL_SECTIONS.get(lower);
        return label != null ? label : heading;
    }

    private static boolean isShortTitle(String title) {
        String trimmed = title.trim();
        return !trimmed.isEmpty() && trimmed.split("\\s+").length <= MAX_HEADING_WORDS;
    }

    private static String stripNumbering(String line) {
        return line.replaceFirst("^(\\d{1,2}(?:\\.\\d{1,2})*|I{1,3}|IV|V|VI{1,3}|IX|X)\\.?\\s+", "").trim();
    }

    private static int countPageBreaks(String line) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '\f') {
                count++;
            }
        }
        return count;
    }

    private static class OpenSection {
        private final String originalName;
        private final StringBuilder content = new StringBuilder();
        private final int startPage;
        private int endPage;

        OpenSection(String originalName, int startPage) {
            this.originalName = originalName;
            this.startPage = startPage;
            this.endPage = startPage;
        }

        void append(String line, int page) {
            content.append(line).append('\n');
            endPage = Math.max(endPage, page);
        }
    }
}
