package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.Variable;
import com.example.formulamap.dto.formula.VariableType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans formula markup for variable symbols.
 *
 * Token grammar, applied in order with each match masked before the next step:
 * decorated symbols ({@code \hat{x}}, {@code \mathbf{W}}), subscripted symbols
 * ({@code x_i}, {@code \theta_{t}}), greek letters, then standalone single letters.
 * Text and operator-name commands are removed first, so {@code \log}, {@code \text{loss}}
 * and plain words never produce variables. The differential {@code d} of {@code d x} is
 * dropped as well.
 */
@Component
public class VariableExtractor {

    private static final String GREEK_NAMES =
        "alpha|beta|gamma|delta|epsilon|varepsilon|zeta|eta|theta|vartheta|iota|kappa|lambda|mu|nu|xi|pi|"
        + "rho|varrho|sigma|tau|upsilon|phi|varphi|chi|psi|omega|"
        + "Gamma|Delta|Theta|Lambda|Xi|Pi|Sigma|Upsilon|Phi|Psi|Omega";

    private static final Pattern TEXT_COMMANDS = Pattern.compile(
        "\\\\(?:text|textrm|textbf|textit|mathrm|operatorname|mbox|label)\\*?\\{[^{}]*\\}"
    );
    // differential operator in d x or d\theta, not a variable
    private static final Pattern DIFFERENTIAL = Pattern.compile(
        "(?<![A-Za-z\\\\_^])d(?=\\s*(?:\\\\(?:" + GREEK_NAMES + ")(?![A-Za-z])|[A-Za-z](?![A-Za-z])))"
    );
    private static final Pattern DECORATED = Pattern.compile(
        "\\\\(hat|widehat|bar|overline|tilde|widetilde|vec|dot|ddot|mathbf|boldsymbol|bm|mathcal|mathbb)"
        + "\\s*\\{\\s*(\\\\(?:" + GREEK_NAMES + ")|[A-Za-z])\\s*\\}"
    );
    private static final Pattern SUBSCRIPTED = Pattern.compile(
        "(\\\\(?:" + GREEK_NAMES + ")(?![A-Za-z])|(?<![A-Za-z\\\\])[A-Za-z])\\s*_\\s*(\\{[^{}]*\\}|[A-Za-z0-9])"
    );
    private static final Pattern GREEK = Pattern.compile("\\\\(" + GREEK_NAMES + ")(?![A-Za-z])");
    private static final Pattern UNICODE_GREEK = Pattern.compile("[\\u03B1-\\u03C9\\u0391-\\u03A9]");
    private static final Pattern COMMAND = Pattern.compile("\\\\[A-Za-z]+");
    private static final Pattern SINGLE_LETTER = Pattern.compile("(?<![A-Za-z])([A-Za-z])(?![A-Za-z])");
    private static final Pattern CALL_FOLLOWS = Pattern.compile("^\\s*\\(");

    private static final Map<String, String> GREEK_SYMBOLS = new HashMap<>();
    private static final Map<String, String> ACCENTS = new HashMap<>();

    static {
        String[][] greek = {
            {"alpha", "α"}, {"beta", "β"}, {"gamma", "γ"}, {"delta", "δ"}, {"epsilon", "ε"},
            {"varepsilon", "ε"}, {"zeta", "ζ"}, {"eta", "η"}, {"theta", "θ"}, {"vartheta", "θ"},
            {"iota", "ι"}, {"kappa", "κ"}, {"lambda", "λ"}, {"mu", "μ"}, {"nu", "ν"}, {"xi", "ξ"},
            {"pi", "π"}, {"rho", "ρ"}, {"varrho", "ρ"}, {"sigma", "σ"}, {"tau", "τ"},
            {"upsilon", "υ"}, {"phi", "φ"}, {"varphi", "φ"}, {"chi", "χ"}, {"psi", "ψ"},
            {"omega", "ω"}, {"Gamma", "Γ"}, {"Delta", "Δ"}, {"Theta", "Θ"}, {"Lambda", "Λ"},
            {"Xi", "Ξ"}, {"Pi", "Π"}, {"Sigma", "Σ"}, {"Upsilon", "Υ"}, {"Phi", "Φ"},
            {"Psi", "Ψ"}, {"Omega", "Ω"}
        };
        for (String[] entry : greek) {
            GREEK_SYMBOLS.put(entry[0], entry[1]);
        }

        // combining marks appended to the base symbol
        ACCENTS.put("hat", "\u0302");
        ACCENTS.put("widehat", "\u0302");
        ACCENTS.put("bar", "\u0304");
        ACCENTS.put("overline", "\u0304");
        ACCENTS.put("tilde", "\u0303");
        ACCENTS.put("widetilde", "\u0303");
        ACCENTS.put("vec", "\u20D7");
        ACCENTS.put("dot", "\u0307");
        ACCENTS.put("ddot", "\u0308");
    }

    /**
     * Returns the distinct variables of the markup in the order they were recognized.
     */
    public List<Variable> extract(String latex) {
        List<Variable> variables = new ArrayList<>();
        if (latex == null || latex.isBlank()) {
            return variables;
        }

        Set<String> seen = new LinkedHashSet<>();
        String working = TEXT_COMMANDS.matcher(latex).replaceAll(" ");
        working = DIFFERENTIAL.matcher(working).replaceAll(" ");

        StringBuilder masked = new StringBuilder();
        Matcher decorated = DECORATED.matcher(working);
        while (decorated.find()) {
            String decoration = decorated.group(1);
            String base = toSymbol(decorated.group(2));
            String symbol = ACCENTS.containsKey(decoration) ? base + ACCENTS.get(decoration) : base;
            add(variables, seen, symbol, decorated.group(), decoratedType(decoration, base));
            decorated.appendReplacement(masked, " ");
        }
        decorated.appendTail(masked);
        working = masked.toString();

        masked = new StringBuilder();
        Matcher subscripted = SUBSCRIPTED.matcher(working);
        while (subscripted.find()) {
            String base = toSymbol(subscripted.group(1));
            String index = subscripted.group(2).replaceAll("^\\{|\\}$", "").replaceAll("\\s+", "");
            add(variables, seen, base + "_" + index, subscripted.group().replaceAll("\\s+", ""),
                letterType(base, followedByCall(working, subscripted.end())));
            subscripted.appendReplacement(masked, " ");
        }
        subscripted.appendTail(masked);
        working = masked.toString();

        masked = new StringBuilder();
        Matcher greek = GREEK.matcher(working);
        while (greek.find()) {
            String symbol = GREEK_SYMBOLS.getOrDefault(greek.group(1), greek.group(1));
            add(variables, seen, symbol, "\\" + greek.group(1),
                letterType(symbol, followedByCall(working, greek.end())));
            greek.appendReplacement(masked, " ");
        }
        greek.appendTail(masked);
        working = masked.toString();

        Matcher unicodeGreek = UNICODE_GREEK.matcher(working);
        while (unicodeGreek.find()) {
            String symbol = unicodeGreek.group();
            add(variables, seen, symbol, symbol, letterType(symbol, followedByCall(working, unicodeGreek.end())));
        }

        working = COMMAND.matcher(working).replaceAll(" ");
        Matcher single = SINGLE_LETTER.matcher(working);
        while (single.find()) {
            String symbol = single.group(1);
            add(variables, seen, symbol, symbol, letterType(symbol, followedByCall(working, single.end())));
        }

        return variables;
    }

    private static void add(List<Variable> variables, Set<String> seen, String symbol, String latex, VariableType type) {
        if (seen.add(symbol)) {
            variables.add(new Variable(symbol, latex, type));
        }
    }

    private static String toSymbol(String token) {
        if (token.startsWith("\\")) {
            String name = token.substring(1);
            return GREEK_SYMBOLS.getOrDefault(name, name);
        }
        return token;
    }

    private static boolean followedByCall(String text, int end) {
        return CALL_FOLLOWS.matcher(text.substring(Math.min(end, text.length()))).find();
    }

    private static VariableType decoratedType(String decoration, String base) {
        switch (decoration) {
            case "mathbf":
            case "boldsymbol":
            case "bm":
            case "vec":
                return VariableType.VECTOR;
            case "mathbb":
            case "mathcal":
                return VariableType.SET;
            default:
                return letterType(base, false);
        }
    }

    static VariableType letterType(String symbol, boolean isCall) {
        if (isCall) {
            return VariableType.FUNCTION;
        }
        int first = symbol.codePointAt(0);
        if (Character.isUpperCase(first)) {
            return Character.isLetter(first) && first < 128 ? VariableType.MATRIX : VariableType.UNKNOWN;
        }
        if (Character.isLowerCase(first)) {
            return VariableType.SCALAR;
        }
        return VariableType.UNKNOWN;
    }
}
