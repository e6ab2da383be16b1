package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.ai.RelationshipInferenceResult;
import com.example.formulamap.dto.ai.RelationshipProposal;
import com.example.formulamap.dto.formula.DependencyType;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.service.ai.RelationshipInferenceService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.example.formulamap.service.analysis.AnalysisFixtures.formula;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DependencyGraphBuilderTest {

    @Mock
    private RelationshipInferenceService inferenceService;

    @InjectMocks
    private DependencyGraphBuilder builder;

    private final List<Formula> formulas = List.of(
        formula("f1", FormulaRole.DEFINITION, "x", "y"),
        formula("f2", FormulaRole.DERIVATION, "x", "y"),
        formula("f3", FormulaRole.OBJECTIVE, "y"));

    @Test
    void sharedVariablesLinkEarlierToLaterOncePerPair() {
        List<FormulaDependency> edges = builder.build(formulas, false, null);

        assertThat(edges).extracting(e -> e.getFrom() + "->" + e.getTo())
            .containsExactly("f1->f2", "f1->f3", "f2->f3");
        assertThat(edges.get(0).getSharedVariables()).containsExactly("x", "y");
        assertThat(edges.get(0).getType()).isEqualTo(DependencyType.USES_VARIABLE);
        assertThat(edges.get(1).getSharedVariables()).containsExactly("y");
        verifyNoInteractions(inferenceService);
    }

    @Test
    void mergesOnlyValidProposalsForNewPairs() {
        when(inferenceService.inferRelationships(anyList())).thenReturn(RelationshipInferenceResult.success(List.of(
            new RelationshipProposal("f1", "f3", "derives_from", "already linked"),
            new RelationshipProposal("f3", "f1", "combines", "new pair"),
            new RelationshipProposal("f1", "f1", "substitutes", "self loop"),
            new RelationshipProposal("f1", "zz", "derives_from", "unknown id"),
            new RelationshipProposal("f2", "f1", "bogus", "unknown type"))));

        List<FormulaDependency> edges = builder.build(formulas, true, null);

        assertThat(edges).hasSize(4);
        FormulaDependency added = edges.get(3);
        assertThat(added.getFrom()).isEqualTo("f3");
        assertThat(added.getTo()).isEqualTo("f1");
        assertThat(added.getType()).isEqualTo(DependencyType.COMBINES);
        assertThat(edges.get(1).getType()).isEqualTo(DependencyType.USES_VARIABLE);
    }

    @Test
    void throwingCollaboratorContributesNothing() {
        when(inferenceService.inferRelationships(anyList())).thenThrow(new IllegalStateException("boom"));

        assertThat(builder.build(formulas, true, null)).hasSize(3);
    }

    @Test
    void failedInferenceContributesNothing() {
        when(inferenceService.inferRelationships(anyList()))
            .thenReturn(RelationshipInferenceResult.failure("quota exceeded"));

        assertThat(builder.build(formulas, true, null)).hasSize(3);
    }

    @Test
    void inferenceSkippedAboveSizeLimit() {
        assertThat(builder.build(formulas, true, 2)).hasSize(3);
        verifyNoInteractions(inferenceService);
    }

    @Test
    void isolatedFormulasHaveNoEdges() {
        List<FormulaDependency> edges = builder.build(List.of(
            formula("a", FormulaRole.UNKNOWN, "p"),
            formula("b", FormulaRole.UNKNOWN, "q")), false, null);

        assertThat(edges).isEmpty();
    }
}
