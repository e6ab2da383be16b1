package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.FormulaRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Assigns a rhetorical role to a single formula from its markup and surrounding prose.
 *
 * The rule table below is evaluated in order. Every rule scores one point per context
 * keyword found and adds the weight of each markup cue present. The highest score
 * wins and a tie goes to the rule listed first, so the table order is the tie-break
 * policy. A formula that scores nothing is {@link FormulaRole#UNKNOWN} with confidence 0.
 */
@Component
public class RoleClassifier {

    static final List<RoleRule> RULES = List.of(
        new RoleRule(FormulaRole.DEFINITION,
            keywords("define", "defines", "defined", "definition", "denote", "denotes", "denoted",
                "let", "given", "where", "is defined as", "정의"),
            List.of(new MarkupCue(":=|\\\\triangleq|\\\\coloneqq|\\\\equiv", 2))),
        new RoleRule(FormulaRole.OBJECTIVE,
            keywords("minimize", "minimise", "minimizing", "maximize", "maximise", "maximizing",
                "loss", "cost", "objective", "optimize", "optimise", "argmin", "argmax", "목적", "손실"),
            List.of(new MarkupCue("\\\\min(?![a-z])|\\\\max(?![a-z])|argmin|argmax|\\\\arg\\s*\\\\?(?:min|max)", 2))),
        new RoleRule(FormulaRole.THEOREM,
            keywords("theorem", "proposition", "lemma", "corollary", "proof", "prove", "정리", "명제"),
            List.of()),
        new RoleRule(FormulaRole.CONSTRAINT,
            keywords("subject to", "constraint", "constraints", "s.t.", "such that", "satisfies", "제약", "조건"),
            List.of(new MarkupCue("\\\\(?:leq?|geq?|neq)(?![a-z])|[<>≤≥]", 1))),
        new RoleRule(FormulaRole.DERIVATION,
            keywords("derive", "derives", "derived", "follows", "therefore", "thus", "hence",
                "substituting", "expanding", "rearranging", "유도", "따라서"),
            List.of()),
        new RoleRule(FormulaRole.APPROXIMATION,
            keywords("approximately", "approximate", "approximation", "approx", "≈", "estimate",
                "asymptotic", "근사"),
            List.of(new MarkupCue("\\\\approx|≈|\\\\simeq|\\\\sim(?![a-z])", 2))),
        new RoleRule(FormulaRole.EXAMPLE,
            keywords("example", "instance", "for example", "e.g.", "such as", "예시", "예를 들어"),
            List.of()),
        new RoleRule(FormulaRole.BASELINE,
            keywords("baseline", "previous", "prior work", "existing", "traditional", "conventional", "기준", "기존"),
            List.of())
    );

    public RoleClassification classify(String latex, String context) {
        String contextLower = context != null ? context.toLowerCase(Locale.ROOT) : "";
        String markup = latex != null ? latex : "";

        RoleRule best = null;
        int bestScore = 0;
        for (RoleRule rule : RULES) {
            int score = rule.score(contextLower, markup);
            if (score > bestScore) {
                best = rule;
                bestScore = score;
            }
        }

        if (best == null) {
            return new RoleClassification(FormulaRole.UNKNOWN, 0.0);
        }
        return new RoleClassification(best.getRole(), confidenceFor(bestScore));
    }

    static double confidenceFor(int score) {
        return Math.min(0.9, 0.5 + score * 0.1);
    }

    private static List<Pattern> keywords(String... words) {
        List<Pattern> patterns = new ArrayList<>();
        for (String word : Arrays.asList(words)) {
            patterns.add(Pattern.compile("(?<![a-z])" + Pattern.quote(word) + "(?![a-z])"));
        }
        return patterns;
    }

    /**
     * One row of the rule table.
     */
    static class RoleRule {
        private final FormulaRole role;
        private final List<Pattern> keywords;
        private final List<MarkupCue> cues;

        RoleRule(FormulaRole role, List<Pattern> keywords, List<MarkupCue> cues) {
            this.role = role;
            this.keywords = keywords;
            this.cues = cues;
        }

        FormulaRole getRole() {
            return role;
        }

        int score(String contextLower, String latex) {
            int score = 0;
            for (Pattern keyword : keywords) {
                if (keyword.matcher(contextLower).find()) {
                    score++;
                }
            }
            for (MarkupCue cue : cues) {
                if (cue.pattern.matcher(latex).find()) {
                    score += cue.weight;
                }
            }
            return score;
        }
    }

    static class MarkupCue {
        private final Pattern pattern;
        private final int weight;

        MarkupCue(String regex, int weight) {
            this.pattern = Pattern.compile(regex);
            this.weight = weight;
        }
    }
}
