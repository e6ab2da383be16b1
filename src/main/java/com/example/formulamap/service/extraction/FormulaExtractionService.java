package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.ExtractionOptions;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.FormulaType;
import com.example.formulamap.dto.formula.Section;
import com.example.formulamap.dto.formula.Variable;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns sections into classified formulas with stable IDs.
 */
@Service
public class FormulaExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(FormulaExtractionService.class);

    private static final Pattern DEFINITION_MARKUP = Pattern.compile(":=|\\\\triangleq|\\\\coloneqq");

    @Autowired
    private LatexFormulaScanner scanner;

    @Autowired
    private VariableExtractor variableExtractor;

    @Autowired
    private RoleClassifier roleClassifier;

    /**
     * Extracts formulas from all sections in document order.
     * IDs are assigned over the whole document before the inline and numbered-only
     * filters run, so a retained formula keeps its ID under every configuration.
     */
    public List<Formula> extract(List<Section> sections, ExtractionOptions options) {
        ExtractionOptions effective = options != null ? options : ExtractionOptions.defaults();

        List<FormulaCandidate> candidates = new ArrayList<>();
        List<Section> owners = new ArrayList<>();
        for (Section section : sections) {
            List<FormulaCandidate> found = scanner.scan(section.getContent());
            logger.debug("Section '{}': {} formula candidates", section.getName(), found.size());
            candidates.addAll(found);
            for (int i = 0; i < found.size(); i++) {
                owners.add(section);
            }
        }

        List<String> ids = new FormulaIdAssigner().assign(candidates);

        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            FormulaCandidate candidate = candidates.get(i);
            if (!effective.isIncludeInline() && candidate.isInline()) {
                continue;
            }
            if (effective.isNumberedOnly() && !candidate.isNumbered()) {
                continue;
            }
            formulas.add(toFormula(candidate, ids.get(i), owners.get(i)));
        }

        logger.info("Extracted {} formulas ({} candidates) from {} sections",
            formulas.size(), candidates.size(), sections.size());
        return formulas;
    }

    private Formula toFormula(FormulaCandidate candidate, String id, Section section) {
        RoleClassification classification = roleClassifier.classify(candidate.getLatex(), candidate.getContext());
        List<Variable> variables = variableExtractor.extract(candidate.getLatex());
        if (classification.getRole() == FormulaRole.DEFINITION) {
            variables.forEach(v -> v.setDefinedIn(id));
        }

        FormulaType type = candidate.getType();
        if (type == FormulaType.DISPLAY && DEFINITION_MARKUP.matcher(candidate.getLatex()).find()) {
            type = FormulaType.DEFINITION;
        }

        return Formula.builder()
            .id(id)
            .latex(candidate.getLatex())
            .type(type)
            .role(classification.getRole())
            .number(candidate.getNumber())
            .context(candidate.getContext())
            .section(section.getName())
            .pageNumber(section.getStartPage())
            .variables(variables)
            .confidence(classification.getConfidence())
            .build();
    }

    /**
     * Keeps formulas whose section name contains the filter, ignoring case.
     * A blank filter keeps everything.
     */
    public static List<Formula> filterBySection(List<Formula> formulas, String filterSection) {
        if (StringUtils.isBlank(filterSection)) {
            return formulas;
        }
        String needle = filterSection.trim();
        return formulas.stream()
            .filter(f -> StringUtils.containsIgnoreCase(f.getSection(), needle))
            .collect(Collectors.toList());
    }
}
