package com.example.formulamap.service.diagram;

import com.example.formulamap.dto.diagram.DiagramDirection;
import com.example.formulamap.dto.diagram.DiagramEdge;
import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.diagram.DiagramNode;
import com.example.formulamap.dto.diagram.DiagramSubgraph;
import com.example.formulamap.dto.diagram.EdgeStyle;
import com.example.formulamap.dto.diagram.NodeShape;
import com.example.formulamap.dto.formula.DependencyType;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaCluster;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.FormulaType;
import com.example.formulamap.dto.formula.VariableUsage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagramRendererTest {

    private final DiagramRenderer renderer = new DiagramRenderer();

    @Test
    void dependencyGraphHasOneNodePerFormulaAndSkipsDanglingEdges() {
        List<Formula> formulas = List.of(
            formula("eq1", "(1)", FormulaRole.DEFINITION, "x = a + b + c + d + e + f + g"),
            formula("eq2", null, FormulaRole.OBJECTIVE, "y = x"));
        List<FormulaDependency> deps = List.of(
            new FormulaDependency("eq1", "eq2", DependencyType.USES_VARIABLE, List.of("x"), null),
            new FormulaDependency("eq2", "eq1", DependencyType.DERIVES_FROM, List.of(), null),
            new FormulaDependency("eq1", "gone", DependencyType.USES_VARIABLE, List.of("x"), null));
        List<FormulaCluster> clusters = List.of(
            new FormulaCluster("cluster_definition", List.of("eq1"), "Definition formulas", FormulaRole.DEFINITION));

        DiagramGraph graph = renderer.renderDependencyGraph(formulas, deps, clusters, DiagramDirection.TB, "Deps");

        assertThat(graph.getNodes()).extracting(DiagramNode::getId).containsExactly("eq1", "eq2");
        DiagramNode first = graph.getNodes().get(0);
        assertThat(first.getLabel()).isEqualTo("(1)\nx = a + b + c + d + e + f...");
        assertThat(first.getFillColor()).isEqualTo(FormulaRole.DEFINITION.getColor());
        assertThat(graph.getSubgraphs()).extracting(DiagramSubgraph::getLabel).containsExactly("Definition");

        assertThat(graph.getEdges()).hasSize(2);
        assertThat(graph.getEdges().get(0).getLabel()).isEqualTo("x");
        DiagramEdge derived = graph.getEdges().get(1);
        assertThat(derived.getStyle()).isEqualTo(EdgeStyle.THICK);
        assertThat(derived.getLabel()).isEqualTo("derives_from");
    }

    @Test
    void roleFlowLinksConsecutiveGroups() {
        Map<FormulaRole, List<Formula>> groups = new LinkedHashMap<>();
        List<Formula> definitions = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            definitions.add(formula("d" + i, null, FormulaRole.DEFINITION, "a_" + i));
        }
        groups.put(FormulaRole.DEFINITION, definitions);
        groups.put(FormulaRole.THEOREM, List.of(formula("t1", null, FormulaRole.THEOREM, "a \\leq b")));
        groups.put(FormulaRole.DERIVATION, List.of(formula("r1", null, FormulaRole.DERIVATION, "a = b")));
        groups.put(FormulaRole.UNKNOWN, List.of(formula("u1", null, FormulaRole.UNKNOWN, "q")));

        DiagramGraph graph = renderer.renderRoleFlowGraph(groups, DiagramDirection.LR);

        assertThat(graph.getSubgraphs()).extracting(DiagramSubgraph::getId)
            .containsExactly("definition", "derivation", "theorem");
        assertThat(graph.getSubgraphs().get(0).getNodes()).hasSize(5);
        assertThat(graph.getEdges()).extracting(e -> e.getFrom() + "->" + e.getTo())
            .containsExactly("d1->r1", "r1->t1");
        assertThat(graph.getEdges()).allMatch(e -> e.getStyle() == EdgeStyle.DOTTED);
    }

    @Test
    void variableGraphMarksDefiningFormulas() {
        List<Formula> formulas = List.of(
            formula("eq1", null, FormulaRole.DEFINITION, "x = 1"),
            formula("eq2", "(2)", FormulaRole.UNKNOWN, "y = x"));
        VariableUsage x = new VariableUsage("x", "x", null,
            new ArrayList<>(List.of("eq1")), new ArrayList<>(List.of("eq1", "eq2")), "Intro");
        VariableUsage y = new VariableUsage("y", "y", null,
            new ArrayList<>(), new ArrayList<>(List.of("eq2")), "Intro");

        DiagramGraph graph = renderer.renderVariableGraph(List.of(x, y), formulas);

        assertThat(graph.getDirection()).isEqualTo(DiagramDirection.LR);
        assertThat(graph.getNodes()).extracting(DiagramNode::getId).containsExactly("var_x", "var_y", "eq1", "eq2");
        assertThat(graph.getNodes().get(0).getShape()).isEqualTo(NodeShape.CIRCLE);
        assertThat(graph.getNodes().get(0).getFillColor()).isEqualTo(DiagramRenderer.DEFINED_FILL);
        assertThat(graph.getNodes().get(1).getFillColor()).isEqualTo(DiagramRenderer.UNDEFINED_FILL);
        assertThat(graph.getNodes().get(3).getLabel()).isEqualTo("(2)");
        assertThat(graph.getEdges()).extracting(DiagramEdge::getStyle)
            .containsExactly(EdgeStyle.THICK, EdgeStyle.DOTTED, EdgeStyle.DOTTED);
    }

    @Test
    void sanitizesIds() {
        assertThat(DiagramRenderer.sanitizeId("eq-1.a")).isEqualTo("eq_1_a");
        assertThat(DiagramRenderer.sanitizeId("2x")).isEqualTo("_2x");
    }

    private static Formula formula(String id, String number, FormulaRole role, String latex) {
        return Formula.builder()
            .id(id)
            .number(number)
            .latex(latex)
            .type(FormulaType.DISPLAY)
            .role(role)
            .section("Intro")
            .build();
    }
}
