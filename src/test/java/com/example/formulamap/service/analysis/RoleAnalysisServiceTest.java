package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.service.ai.RoleFlowDescriptionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.formulamap.service.analysis.AnalysisFixtures.formula;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoleAnalysisServiceTest {

    @Mock
    private RoleFlowDescriptionService descriptionService;

    @InjectMocks
    private RoleAnalysisService service;

    private final List<Formula> formulas = List.of(
        formula("eq1", FormulaRole.OBJECTIVE),
        formula("eq2", FormulaRole.DEFINITION),
        formula("eq3", FormulaRole.OBJECTIVE),
        formula("eq4", FormulaRole.THEOREM),
        formula("eq5", FormulaRole.BASELINE));

    @Test
    void groupsCoverAllRoles() {
        Map<FormulaRole, List<Formula>> groups = service.group(formulas);

        assertThat(groups).hasSize(9);
        assertThat(groups.keySet()).startsWith(FormulaRole.DEFINITION, FormulaRole.OBJECTIVE);
        assertThat(groups.get(FormulaRole.OBJECTIVE)).extracting(Formula::getId).containsExactly("eq1", "eq3");
        assertThat(groups.get(FormulaRole.UNKNOWN)).isEmpty();
    }

    @Test
    void dominantRolesBreakTiesInVocabularyOrder() {
        List<FormulaRole> dominant = service.dominantRoles(service.group(formulas));

        assertThat(dominant).containsExactly(FormulaRole.OBJECTIVE, FormulaRole.DEFINITION, FormulaRole.THEOREM);
    }

    @Test
    void usesDescriptionWhenAvailable() {
        when(descriptionService.describeLogicalFlow(anyList())).thenReturn(Optional.of(" Definitions lead to the loss. "));

        String flow = service.logicalFlow(formulas, List.of(FormulaRole.OBJECTIVE), true);

        assertThat(flow).isEqualTo("Definitions lead to the loss.");
    }

    @Test
    void fallsBackWhenDescriptionFails() {
        when(descriptionService.describeLogicalFlow(anyList())).thenThrow(new IllegalStateException("timeout"));

        String flow = service.logicalFlow(formulas, List.of(FormulaRole.DEFINITION, FormulaRole.OBJECTIVE), true);

        assertThat(flow).isEqualTo("This paper mainly defines its basic concepts and variables"
            + " and sets up the objective to optimize.");
    }

    @Test
    void singleFormulaNeverAsksForDescription() {
        String flow = service.logicalFlow(formulas.subList(0, 1), List.of(FormulaRole.OBJECTIVE), true);

        assertThat(flow).isEqualTo("This paper mainly sets up the objective to optimize.");
        verifyNoInteractions(descriptionService);
    }

    @Test
    void defaultTextWithoutKnownRoles() {
        assertThat(RoleAnalysisService.defaultFlowDescription(List.of(FormulaRole.UNKNOWN)))
            .isEqualTo(RoleAnalysisService.NO_FLOW_DESCRIPTION);
        assertThat(RoleAnalysisService.defaultFlowDescription(List.of(
            FormulaRole.DEFINITION, FormulaRole.THEOREM, FormulaRole.EXAMPLE)))
            .isEqualTo("This paper mainly defines its basic concepts and variables, presents its main theorems"
                + " and results and gives concrete examples.");
    }
}
