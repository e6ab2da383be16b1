package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.FormulaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds formula candidates in the text of one section.
 *
 * Recognized shapes, checked per line in this order:
 * <ul>
 *   <li>{@code equation}/{@code align}/{@code gather} environments and {@code \[ ... \]} blocks</li>
 *   <li>{@code $$ ... $$} display math, numbered when the line ends with "(n)" or "(n.m)"</li>
 *   <li>any other line ending with a "(n)" marker</li>
 *   <li>document structure lines such as <code>&#92;usepackage{..}</code> are skipped</li>
 *   <li>isolated math-only lines</li>
 *   <li>inline {@code $ ... $} fragments inside prose</li>
 * </ul>
 */
@Component
public class LatexFormulaScanner {

    private static final Logger logger = LoggerFactory.getLogger(LatexFormulaScanner.class);

    private static final Pattern NUMBER_MARKER = Pattern.compile("\\((\\d{1,3}(?:\\.\\d{1,3})?)\\)\\s*$");
    private static final Pattern TAG = Pattern.compile("\\\\tag\\*?\\{(\\d{1,3}(?:\\.\\d{1,3})?)\\}");
    private static final Pattern LABEL = Pattern.compile("\\\\(?:label|nonumber|notag)(?:\\{[^}]*\\})?");
    private static final Pattern ENV_BEGIN = Pattern.compile(
        "\\\\begin\\{(equation|align|gather|multline|eqnarray)(\\*?)\\}"
    );
    private static final Pattern DISPLAY_DOLLARS = Pattern.compile("\\$\\$(.+?)\\$\\$", Pattern.DOTALL);
    private static final Pattern INLINE = Pattern.compile("(?<![$\\\\])\\$([^$\\n]+?)\\$(?!\\$)");
    private static final Pattern PROSE_WORD = Pattern.compile("(?<![\\\\A-Za-z])[A-Za-z]{3,}");
    private static final Pattern HAS_WORD = Pattern.compile("\\p{L}{2,}");

    // document structure such as \\usepackage{amsmath} or \section*{Method}, never math
    private static final Pattern STRUCTURE_LINE = Pattern.compile(
        "(?:\\\\(?:documentclass|usepackage|section|subsection|subsubsection|paragraph|chapter|part"
        + "|title|author|date|maketitle|begin|end|label|cite|citep|citet|ref|eqref|caption|item"
        + "|bibliography|bibliographystyle|include|input|newcommand|renewcommand|tableofcontents"
        + "|footnote|centering|includegraphics|hline|noindent|vspace|hspace|clearpage|newpage"
        + "|appendix|keywords|thanks|affiliation|email)\\*?(?:\\[[^\\]]*\\])?(?:\\{[^{}]*\\})*\\s*)+"
    );

    private static final String[] MATH_INDICATORS = {
        "\\", "_", "^", "=", "+", "-", "\\frac", "\\sum", "\\int",
        "\\partial", "\\nabla", "\\times", "\\cdot", "alpha", "beta",
        "theta", "lambda", "sigma", "omega", "\\log", "\\exp", "\\max", "\\min"
    };

    @Value("${formula.extraction.context-window:100}")
    private int contextWindow = 100;

    /**
     * Scans section content and returns candidates in document order,
     * with later duplicates of the same (normalized) markup removed.
     */
    public List<FormulaCandidate> scan(String content) {
        List<FormulaCandidate> found = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return found;
        }

        String[] lines = content.split("\n", -1);
        int[] offsets = new int[lines.length];
        for (int k = 1; k < lines.length; k++) {
            offsets[k] = offsets[k - 1] + lines[k - 1].length() + 1;
        }

        String previousProse = null;
        int i = 0;
        while (i < lines.length) {
            String line = lines[i].trim();
            int offset = offsets[i];

            if (line.isEmpty()) {
                i++;
                continue;
            }

            Matcher env = ENV_BEGIN.matcher(line);
            if (env.find()) {
                String endToken = "\\end{" + env.group(1) + env.group(2) + "}";
                i = scanBlock(lines, i, line.substring(0, env.start()), line.substring(env.end()),
                    endToken, offset, previousProse, found);
                previousProse = null;
                continue;
            }

            int bracket = line.indexOf("\\[");
            if (bracket >= 0 && !line.contains("$")) {
                i = scanBlock(lines, i, line.substring(0, bracket), line.substring(bracket + 2),
                    "\\]", offset, previousProse, found);
                previousProse = null;
                continue;
            }

            if (line.contains("$$")) {
                int next = scanDisplayDollars(lines, i, offset, previousProse, found);
                if (next > i) {
                    previousProse = null;
                    i = next;
                    continue;
                }
            }

            Matcher marker = NUMBER_MARKER.matcher(line);
            if (marker.find() && !line.substring(0, marker.start()).isBlank()) {
                String body = line.substring(0, marker.start()).trim();
                String number = "(" + marker.group(1) + ")";
                if (INLINE.matcher(body).find()) {
                    scanNumberedInline(lines[i], body, number, offset, previousProse, content, found);
                } else {
                    found.add(new FormulaCandidate(body, FormulaType.EQUATION, number, normalize(body), offset));
                }
                previousProse = null;
                i++;
                continue;
            }

            if (isStructureLine(line)) {
                i++;
                continue;
            }

            if (looksLikeDisplayMath(line)) {
                found.add(new FormulaCandidate(line, FormulaType.DISPLAY, null,
                    previousProse != null ? previousProse : "", offset));
                previousProse = null;
                i++;
                continue;
            }

            Matcher inline = INLINE.matcher(line);
            while (inline.find()) {
                String latex = inline.group(1).trim();
                if (latex.length() > 2 && isValidLatex(latex)) {
                    int position = offset + lines[i].indexOf(line) + inline.start();
                    found.add(new FormulaCandidate(latex, FormulaType.INLINE, null,
                        window(content, position, inline.group().length()), position));
                }
            }
            previousProse = normalize(line);
            i++;
        }

        List<FormulaCandidate> unique = deduplicate(found);
        logger.debug("Scanned {} formula candidates ({} after de-duplication)", found.size(), unique.size());
        return unique;
    }

    /**
     * A prose line carrying several $...$ fragments and a trailing "(n)" marker. The number
     * goes to the last fragment that reads as math; the other fragments stay inline.
     */
    private void scanNumberedInline(String rawLine, String body, String number, int offset,
                                    String previousProse, String content, List<FormulaCandidate> found) {
        List<String> fragments = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        List<Integer> lengths = new ArrayList<>();
        Matcher inline = INLINE.matcher(body);
        while (inline.find()) {
            fragments.add(inline.group(1).trim());
            starts.add(inline.start());
            lengths.add(inline.group().length());
        }

        int numbered = fragments.size() - 1;
        for (int k = fragments.size() - 1; k >= 0; k--) {
            if (isValidLatex(fragments.get(k))) {
                numbered = k;
                break;
            }
        }

        String context = contextFor(INLINE.matcher(body).replaceAll(" "), previousProse);
        int lineStart = offset + Math.max(0, rawLine.indexOf(body));
        for (int k = 0; k < fragments.size(); k++) {
            String latex = fragments.get(k);
            int position = lineStart + starts.get(k);
            if (k == numbered) {
                found.add(new FormulaCandidate(latex, FormulaType.EQUATION, number, context, position));
            } else if (latex.length() > 2 && isValidLatex(latex)) {
                found.add(new FormulaCandidate(latex, FormulaType.INLINE, null,
                    window(content, position, lengths.get(k)), position));
            }
        }
    }

    /**
     * Collects a delimited block (environment or \[ \]) that may span several lines.
     * Returns the index of the first line after the block.
     */
    private int scanBlock(String[] lines, int start, String before, String rest, String endToken,
                          int offset, String previousProse, List<FormulaCandidate> found) {
        StringBuilder block = new StringBuilder(rest);
        int end = start;
        int endIdx = block.indexOf(endToken);
        while (endIdx < 0 && end + 1 < lines.length) {
            end++;
            block.append('\n').append(lines[end].trim());
            endIdx = block.indexOf(endToken);
        }

        String body = endIdx >= 0 ? block.substring(0, endIdx) : block.toString();
        String after = endIdx >= 0 ? block.substring(endIdx + endToken.length()) : "";

        String number = null;
        Matcher tag = TAG.matcher(body);
        if (tag.find()) {
            number = "(" + tag.group(1) + ")";
        }
        if (number == null) {
            number = trailingNumber(after);
        }
        body = LABEL.matcher(TAG.matcher(body).replaceAll(" ")).replaceAll(" ").trim();

        if (!body.isEmpty()) {
            FormulaType type = number != null ? FormulaType.EQUATION : FormulaType.DISPLAY;
            found.add(new FormulaCandidate(body, type, number,
                contextFor(before + " " + stripMarker(after), previousProse), offset));
        }
        return end + 1;
    }

    /**
     * Handles $$ display math, joining lines until the delimiters balance.
     * Returns the start index unchanged when no complete $$ pair is found.
     */
    private int scanDisplayDollars(String[] lines, int start, int offset, String previousProse,
                                   List<FormulaCandidate> found) {
        StringBuilder block = new StringBuilder(lines[start].trim());
        int end = start;
        while (countDelimiters(block) % 2 == 1 && end + 1 < lines.length) {
            end++;
            block.append('\n').append(lines[end].trim());
        }

        String joined = block.toString();
        String number = trailingNumber(joined);
        String withoutMarker = number != null ? stripMarker(joined) : joined;

        Matcher matcher = DISPLAY_DOLLARS.matcher(withoutMarker);
        List<String> bodies = new ArrayList<>();
        StringBuilder prose = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            prose.append(withoutMarker, last, matcher.start()).append(' ');
            bodies.add(matcher.group(1).trim());
            last = matcher.end();
        }
        prose.append(withoutMarker.substring(last));

        if (bodies.isEmpty()) {
            return start;
        }

        String context = contextFor(prose.toString(), previousProse);
        for (int k = 0; k < bodies.size(); k++) {
            String body = bodies.get(k);
            if (body.isEmpty()) {
                continue;
            }
            // a trailing marker numbers the last formula on the line
            String formulaNumber = k == bodies.size() - 1 ? number : null;
            FormulaType type = formulaNumber != null ? FormulaType.EQUATION : FormulaType.DISPLAY;
            found.add(new FormulaCandidate(body, type, formulaNumber, context, offset + k));
        }
        return end + 1;
    }

    /**
     * Prose on the formula's own line; falls back to the preceding prose line.
     */
    private String contextFor(String ownLineProse, String previousProse) {
        String normalized = normalize(ownLineProse);
        if (HAS_WORD.matcher(normalized).find()) {
            return normalized;
        }
        return previousProse != null ? previousProse : "";
    }

    private String window(String content, int position, int length) {
        int start = Math.max(0, position - contextWindow);
        int end = Math.min(content.length(), position + length + contextWindow);
        return normalize(content.substring(start, end));
    }

    static boolean looksLikeDisplayMath(String line) {
        if (line.length() < 3 || line.contains("$")) {
            return false;
        }
        if (isStructureLine(line)) {
            return false;
        }
        boolean hasOperator = line.contains("=") || line.contains("≤") || line.contains("≥")
            || line.contains("≈") || line.contains("\\");
        if (!hasOperator) {
            return false;
        }
        int proseWords = 0;
        Matcher words = PROSE_WORD.matcher(line);
        while (words.find()) {
            proseWords++;
        }
        return proseWords <= 1;
    }

    static boolean isStructureLine(String line) {
        return STRUCTURE_LINE.matcher(line.trim()).matches();
    }

    static boolean isValidLatex(String latex) {
        if (latex.length() < 2) return false;
        if (latex.matches("^[a-zA-Z0-9]$")) return false;
        if (latex.matches("^\\d+$")) return false;

        for (String indicator : MATH_INDICATORS) {
            if (latex.contains(indicator)) {
                return true;
            }
        }
        return Pattern.compile("[a-z].*[=+\\-*/]").matcher(latex).find();
    }

    /**
     * Whitespace and sizing commands are ignored when comparing markup.
     */
    public static String normalizeLatex(String latex) {
        return latex
            .replaceAll("\\s+", " ")
            .replace("\\left", "")
            .replace("\\right", "")
            .replace("\\Big", "")
            .replace("\\big", "")
            .trim();
    }

    private static List<FormulaCandidate> deduplicate(List<FormulaCandidate> candidates) {
        Set<String> seen = new HashSet<>();
        List<FormulaCandidate> unique = new ArrayList<>();
        for (FormulaCandidate candidate : candidates) {
            if (seen.add(normalizeLatex(candidate.getLatex()))) {
                unique.add(candidate);
            }
        }
        return unique;
    }

    private static String trailingNumber(String text) {
        Matcher marker = NUMBER_MARKER.matcher(text.trim());
        return marker.find() ? "(" + marker.group(1) + ")" : null;
    }

    private static String stripMarker(String text) {
        return NUMBER_MARKER.matcher(text.trim()).replaceFirst("").trim();
    }

    private static int countDelimiters(CharSequence text) {
        int count = 0;
        String s = text.toString();
        int idx = s.indexOf("$$");
        while (idx >= 0) {
            count++;
            idx = s.indexOf("$$", idx + 2);
        }
        return count;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
