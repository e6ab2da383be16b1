package com.example.formulamap.service;

import com.example.formulamap.dto.DependencyAnalysisResult;
import com.example.formulamap.dto.DocumentText;
import com.example.formulamap.dto.ExtractFormulasResult;
import com.example.formulamap.dto.ExtractionOptions;
import com.example.formulamap.dto.RoleAnalysisResult;
import com.example.formulamap.dto.VariableAnalysisResult;
import com.example.formulamap.dto.VariableOutputFormat;
import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.Section;
import com.example.formulamap.dto.formula.VariableUsage;
import com.example.formulamap.service.analysis.DependencyGraphBuilder;
import com.example.formulamap.service.analysis.GraphAnalyzer;
import com.example.formulamap.service.analysis.RoleAnalysisService;
import com.example.formulamap.service.analysis.VariableUsageTracker;
import com.example.formulamap.service.diagram.DiagramRenderer;
import com.example.formulamap.service.diagram.DiagramSyntaxWriter;
import com.example.formulamap.service.diagram.VariableTableFormatter;
import com.example.formulamap.service.extraction.FormulaExtractionService;
import com.example.formulamap.service.extraction.PaperTitleExtractor;
import com.example.formulamap.service.extraction.SectionSegmentationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the formula pipeline for one document and builds the four analysis results.
 * Input problems and unexpected errors come back as failure results, never as exceptions.
 */
@Service
public class FormulaAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(FormulaAnalysisService.class);

    static final String NO_TEXT_ERROR = "Document text is empty";

    @Autowired
    private SectionSegmentationService segmentationService;

    @Autowired
    private FormulaExtractionService extractionService;

    @Autowired
    private PaperTitleExtractor titleExtractor;

    @Autowired
    private VariableUsageTracker variableUsageTracker;

    @Autowired
    private DependencyGraphBuilder dependencyGraphBuilder;

    @Autowired
    private GraphAnalyzer graphAnalyzer;

    @Autowired
    private RoleAnalysisService roleAnalysisService;

    @Autowired
    private DiagramRenderer diagramRenderer;

    @Autowired
    private DiagramSyntaxWriter diagramWriter;

    @Autowired
    private VariableTableFormatter variableTableFormatter;

    public ExtractFormulasResult extractFormulas(DocumentText document, ExtractionOptions options) {
        if (document == null || document.isBlank()) {
            return ExtractFormulasResult.failure(NO_TEXT_ERROR);
        }
        try {
            Extraction extraction = extract(document, options);
            return ExtractFormulasResult.success(extraction.title, extraction.formulas);
        } catch (Exception e) {
            logger.error("❌ Formula extraction failed: {}", e.getMessage(), e);
            return ExtractFormulasResult.failure(e.getMessage());
        }
    }

    public DependencyAnalysisResult analyzeDependencies(DocumentText document, ExtractionOptions options) {
        if (document == null || document.isBlank()) {
            return DependencyAnalysisResult.failure(NO_TEXT_ERROR);
        }
        try {
            ExtractionOptions effective = effective(options);
            Extraction extraction = extract(document, effective);
            List<Formula> formulas = extraction.formulas;

            List<FormulaDependency> dependencies = dependencyGraphBuilder.build(formulas,
                effective.isUseAiInference(), effective.getMaxDependencyInferenceSize());
            DependencyAnalysisResult.Analysis analysis = graphAnalyzer.analyze(formulas, dependencies);

            DiagramGraph graph = diagramRenderer.renderDependencyGraph(formulas, dependencies,
                analysis.getClusters(), effective.getDirection(), extraction.title);
            String mermaid = diagramWriter.write(graph);

            logger.info("🔗 {} formulas, {} dependencies, {} roots, {} leaves", analysis.getTotalFormulas(),
                analysis.getTotalDependencies(), analysis.getRootFormulas().size(), analysis.getLeafFormulas().size());
            return new DependencyAnalysisResult(true, analysis, dependencies, graph, mermaid,
                diagramWriter.wrapInMarkdown(mermaid), null);
        } catch (Exception e) {
            logger.error("❌ Dependency analysis failed: {}", e.getMessage(), e);
            return DependencyAnalysisResult.failure(e.getMessage());
        }
    }

    public VariableAnalysisResult analyzeVariables(DocumentText document, ExtractionOptions options) {
        if (document == null || document.isBlank()) {
            return VariableAnalysisResult.failure(NO_TEXT_ERROR);
        }
        try {
            ExtractionOptions effective = effective(options);
            List<Formula> formulas = extract(document, effective).formulas;

            List<VariableUsage> usages = variableUsageTracker.filterSymbols(
                variableUsageTracker.track(formulas), effective.getFilterSymbols());

            VariableAnalysisResult result = new VariableAnalysisResult();
            result.setSuccess(true);
            result.setVariables(usages);
            result.setStats(variableUsageTracker.stats(usages));

            VariableOutputFormat format = effective.getVariableOutputFormat() != null
                ? effective.getVariableOutputFormat() : VariableOutputFormat.MERMAID;
            if (format == VariableOutputFormat.MERMAID) {
                DiagramGraph graph = diagramRenderer.renderVariableGraph(usages, formulas);
                String mermaid = diagramWriter.write(graph);
                result.setGraph(graph);
                result.setMermaid(mermaid);
                result.setMarkdown(diagramWriter.wrapInMarkdown(mermaid));
            } else if (format == VariableOutputFormat.TABLE) {
                result.setTable(variableTableFormatter.format(usages));
            }

            logger.info("🔤 {} variables ({} defined)", result.getStats().getTotalVariables(),
                result.getStats().getDefinedVariables());
            return result;
        } catch (Exception e) {
            logger.error("❌ Variable analysis failed: {}", e.getMessage(), e);
            return VariableAnalysisResult.failure(e.getMessage());
        }
    }

    public RoleAnalysisResult analyzeRoles(DocumentText document, ExtractionOptions options) {
        if (document == null || document.isBlank()) {
            return RoleAnalysisResult.failure(NO_TEXT_ERROR);
        }
        try {
            ExtractionOptions effective = effective(options);
            List<Formula> formulas = extract(document, effective).formulas;

            Map<FormulaRole, List<Formula>> groups = roleAnalysisService.group(formulas);
            List<FormulaRole> dominant = roleAnalysisService.dominantRoles(groups);
            String logicalFlow = roleAnalysisService.logicalFlow(formulas, dominant, effective.isUseAiInference());

            DiagramGraph flowGraph = diagramRenderer.renderRoleFlowGraph(groups, effective.getDirection());
            String mermaid = diagramWriter.write(flowGraph);

            Map<String, List<Formula>> roleGroups = new LinkedHashMap<>();
            groups.forEach((role, members) -> roleGroups.put(role.getValue(), members));

            logger.info("🎭 Dominant roles: {}", dominant);
            return new RoleAnalysisResult(true, roleGroups, flowGraph, mermaid,
                diagramWriter.wrapInMarkdown(mermaid), new RoleAnalysisResult.Analysis(dominant, logicalFlow), null);
        } catch (Exception e) {
            logger.error("❌ Role analysis failed: {}", e.getMessage(), e);
            return RoleAnalysisResult.failure(e.getMessage());
        }
    }

    private Extraction extract(DocumentText document, ExtractionOptions options) {
        ExtractionOptions effective = effective(options);
        List<Section> sections = segmentationService.segment(document);
        List<Formula> formulas = extractionService.extract(sections, effective);
        formulas = FormulaExtractionService.filterBySection(formulas, effective.getFilterSection());
        return new Extraction(titleExtractor.extractTitle(document), formulas);
    }

    private static ExtractionOptions effective(ExtractionOptions options) {
        return options != null ? options : ExtractionOptions.defaults();
    }

    private static class Extraction {
        private final String title;
        private final List<Formula> formulas;

        Extraction(String title, List<Formula> formulas) {
            this.title = title;
            this.formulas = formulas;
        }
    }
}
