package com.example.formulamap.service;

import com.example.formulamap.dto.DependencyAnalysisResult;
import com.example.formulamap.dto.DocumentText;
import com.example.formulamap.dto.ExtractFormulasResult;
import com.example.formulamap.dto.ExtractionOptions;
import com.example.formulamap.dto.RoleAnalysisResult;
import com.example.formulamap.dto.VariableAnalysisResult;
import com.example.formulamap.dto.VariableOutputFormat;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.VariableUsage;
import com.example.formulamap.service.extraction.FormulaExtractionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "ai.provider.openai.enabled=false",
    "ai.provider.gemini.enabled=false"
})
class FormulaAnalysisServiceTest {

    private static final String PAPER = "We define x as the input (1)\n"
        + "$$y = f(x)$$ (2)\n"
        + "Minimize the loss $$L = y^2$$ (3)";

    @Autowired
    private FormulaAnalysisService service;

    @Test
    void extractsFormulasWithStats() {
        ExtractFormulasResult result = service.extractFormulas(new DocumentText(PAPER), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFormulas()).extracting(Formula::getId).containsExactly("eq1", "eq2", "eq3");
        assertThat(result.getStats().getTotalFormulas()).isEqualTo(3);
        assertThat(result.getStats().getByRole())
            .containsEntry("definition", 1)
            .containsEntry("objective", 1)
            .containsEntry("unknown", 1)
            .containsEntry("theorem", 0);
    }

    @Test
    void dependencyChainFollowsSharedVariables() {
        DependencyAnalysisResult result = service.analyzeDependencies(new DocumentText(PAPER), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDependencies()).extracting(d -> d.getFrom() + "->" + d.getTo())
            .containsExactly("eq1->eq2", "eq2->eq3");
        assertThat(result.getDependencies()).extracting(FormulaDependency::getSharedVariables)
            .containsExactly(List.of("x"), List.of("y"));
        assertThat(result.getAnalysis().getRootFormulas()).containsExactly("eq1");
        assertThat(result.getAnalysis().getLeafFormulas()).containsExactly("eq3");
        assertThat(result.getMermaid()).startsWith("flowchart TB");
        assertThat(result.getMarkdown()).startsWith("```mermaid\n").endsWith("\n```");
    }

    @Test
    void variablesInFirstAppearanceOrder() {
        VariableAnalysisResult result = service.analyzeVariables(new DocumentText(PAPER), null);

        assertThat(result.getVariables()).extracting(VariableUsage::getSymbol).containsExactly("x", "y", "f", "L");
        assertThat(result.getStats().getTotalVariables()).isEqualTo(4);
        assertThat(result.getStats().getDefinedVariables()).isEqualTo(1);
        assertThat(result.getMermaid()).startsWith("flowchart LR");
        assertThat(result.getTable()).isNull();
    }

    @Test
    void tableFormatSkipsDiagram() {
        ExtractionOptions options = ExtractionOptions.builder()
            .variableOutputFormat(VariableOutputFormat.TABLE)
            .filterSymbols(List.of("x"))
            .build();

        VariableAnalysisResult result = service.analyzeVariables(new DocumentText(PAPER), options);

        assertThat(result.getMermaid()).isNull();
        assertThat(result.getGraph()).isNull();
        assertThat(result.getTable()).contains("| x | `x` | eq1 | eq1, eq2 |");
    }

    @Test
    void rolesFallBackToDefaultFlowWithoutProviders() {
        RoleAnalysisResult result = service.analyzeRoles(new DocumentText(PAPER), null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRoleGroups()).hasSize(9);
        assertThat(result.getAnalysis().getDominantRoles())
            .containsExactly(FormulaRole.DEFINITION, FormulaRole.OBJECTIVE, FormulaRole.UNKNOWN);
        assertThat(result.getAnalysis().getLogicalFlow()).isEqualTo("This paper mainly defines its basic concepts"
            + " and variables and sets up the objective to optimize.");
    }

    @Test
    void blankInputIsAFailure() {
        assertThat(service.extractFormulas(new DocumentText("   "), null).getError())
            .isEqualTo(FormulaAnalysisService.NO_TEXT_ERROR);
        assertThat(service.analyzeDependencies(new DocumentText(""), null).isSuccess()).isFalse();
        assertThat(service.analyzeVariables(null, null).isSuccess()).isFalse();
        assertThat(service.analyzeRoles(new DocumentText("\n"), null).getMermaid()).isEmpty();
    }

    @Test
    void sectionFilterKeepsMatchingSections() {
        String paper = "1 Introduction\nWe define x as the input $$x = 1$$ (1)\n"
            + "2 Method\nThe update rule is $$y = x + 1$$ (2)";
        ExtractionOptions options = ExtractionOptions.builder().filterSection("method").build();

        List<Formula> once = service.extractFormulas(new DocumentText(paper), options).getFormulas();

        assertThat(once).extracting(Formula::getId).containsExactly("eq2");
        assertThat(once).allSatisfy(f -> assertThat(f.getSection()).containsIgnoringCase("method"));

        List<Formula> unfiltered = service.extractFormulas(new DocumentText(paper), null).getFormulas();
        assertThat(FormulaExtractionService.filterBySection(
            FormulaExtractionService.filterBySection(unfiltered, "method"), "method")).isEqualTo(once);
    }
}
