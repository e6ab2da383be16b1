package com.example.formulamap.service.diagram;

import com.example.formulamap.dto.diagram.DiagramDirection;
import com.example.formulamap.dto.diagram.DiagramEdge;
import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.diagram.DiagramNode;
import com.example.formulamap.dto.diagram.DiagramSubgraph;
import com.example.formulamap.dto.diagram.EdgeArrow;
import com.example.formulamap.dto.diagram.EdgeStyle;
import com.example.formulamap.dto.diagram.NodeShape;
import com.example.formulamap.dto.formula.DependencyType;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaCluster;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.VariableUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects formulas, dependencies and variable usages into {@link DiagramGraph}s.
 * The graphs carry no drawing syntax; see {@link DiagramSyntaxWriter} for that.
 */
@Component
public class DiagramRenderer {

    private static final Logger logger = LoggerFactory.getLogger(DiagramRenderer.class);

    static final int LABEL_PREVIEW_LENGTH = 25;
    static final int ROLE_FLOW_PREVIEW_LENGTH = 30;
    static final int MAX_EDGE_LABEL_VARIABLES = 3;
    static final int MAX_ROLE_FLOW_NODES = 5;
    static final int MAX_VARIABLE_NODES = 15;
    static final int MAX_FORMULAS_PER_VARIABLE = 3;

    static final String STROKE_COLOR = "#333";
    static final String DEFINED_FILL = "#e8f5e9";
    static final String DEFINED_STROKE = "#4caf50";
    static final String UNDEFINED_FILL = "#ffebee";
    static final String UNDEFINED_STROKE = "#f44336";
    static final String FORMULA_FILL = "#e3f2fd";
    static final String FORMULA_STROKE = "#2196f3";

    /**
     * Flow order of the role-flow graph. Theorems come after derivations here, unlike
     * the vocabulary order; unknown formulas are left out.
     */
    static final List<FormulaRole> ROLE_FLOW_ORDER = List.of(
        FormulaRole.DEFINITION,
        FormulaRole.OBJECTIVE,
        FormulaRole.CONSTRAINT,
        FormulaRole.DERIVATION,
        FormulaRole.THEOREM,
        FormulaRole.APPROXIMATION,
        FormulaRole.EXAMPLE,
        FormulaRole.BASELINE
    );

    public DiagramGraph renderDependencyGraph(List<Formula> formulas, List<FormulaDependency> dependencies,
                                              List<FormulaCluster> clusters, DiagramDirection direction,
                                              String title) {
        List<DiagramNode> nodes = new ArrayList<>();
        Set<String> nodeIds = new HashSet<>();
        for (Formula formula : formulas) {
            DiagramNode node = formulaNode(formula, LABEL_PREVIEW_LENGTH);
            nodes.add(node);
            nodeIds.add(node.getId());
        }

        List<DiagramSubgraph> subgraphs = new ArrayList<>();
        for (FormulaCluster cluster : clusters) {
            List<String> members = new ArrayList<>();
            for (String id : cluster.getFormulas()) {
                String nodeId = sanitizeId(id);
                if (nodeIds.contains(nodeId)) {
                    members.add(nodeId);
                }
            }
            if (!members.isEmpty()) {
                String label = cluster.getRole() != null ? cluster.getRole().getLabel() : cluster.getDescription();
                subgraphs.add(new DiagramSubgraph(sanitizeId(cluster.getId()), label, members));
            }
        }

        List<DiagramEdge> edges = new ArrayList<>();
        for (FormulaDependency dependency : dependencies) {
            String from = sanitizeId(dependency.getFrom());
            String to = sanitizeId(dependency.getTo());
            if (!nodeIds.contains(from) || !nodeIds.contains(to)) {
                logger.debug("Skipping edge {} -> {}: node missing", dependency.getFrom(), dependency.getTo());
                continue;
            }
            edges.add(DiagramEdge.builder()
                .from(from)
                .to(to)
                .label(edgeLabel(dependency))
                .style(dependency.getType() == DependencyType.DERIVES_FROM ? EdgeStyle.THICK : EdgeStyle.SOLID)
                .arrow(EdgeArrow.NORMAL)
                .build());
        }

        return new DiagramGraph(direction, title, nodes, edges, subgraphs);
    }

    /**
     * One subgraph per role in flow order with up to five formulas each, and a dotted
     * edge from the first node of a role group to the first node of the next one.
     */
    public DiagramGraph renderRoleFlowGraph(Map<FormulaRole, List<Formula>> roleGroups, DiagramDirection direction) {
        List<DiagramNode> nodes = new ArrayList<>();
        List<DiagramEdge> edges = new ArrayList<>();
        List<DiagramSubgraph> subgraphs = new ArrayList<>();

        String previousFirst = null;
        for (FormulaRole role : ROLE_FLOW_ORDER) {
            List<Formula> formulas = roleGroups.getOrDefault(role, List.of());
            if (formulas.isEmpty()) {
                continue;
            }

            List<String> members = new ArrayList<>();
            for (Formula formula : formulas.subList(0, Math.min(MAX_ROLE_FLOW_NODES, formulas.size()))) {
                DiagramNode node = DiagramNode.builder()
                    .id(sanitizeId(formula.getId()))
                    .label(formula.getId() + "\n" + preview(formula.getLatex(), ROLE_FLOW_PREVIEW_LENGTH))
                    .shape(NodeShape.ROUNDED)
                    .role(role)
                    .fillColor(role.getColor())
                    .strokeColor(STROKE_COLOR)
                    .build();
                nodes.add(node);
                members.add(node.getId());
            }
            subgraphs.add(new DiagramSubgraph(sanitizeId(role.getValue()), role.getLabel(), members));

            if (previousFirst != null) {
                edges.add(DiagramEdge.builder()
                    .from(previousFirst)
                    .to(members.get(0))
                    .style(EdgeStyle.DOTTED)
                    .arrow(EdgeArrow.NORMAL)
                    .build());
            }
            previousFirst = members.get(0);
        }

        return new DiagramGraph(direction, "Role flow", nodes, edges, subgraphs);
    }

    /**
     * Variables as circles linked to the formulas using them, left to right.
     * A thick edge marks a formula that defines the variable.
     */
    public DiagramGraph renderVariableGraph(List<VariableUsage> variables, List<Formula> formulas) {
        List<VariableUsage> shown = variables.subList(0, Math.min(MAX_VARIABLE_NODES, variables.size()));

        List<DiagramNode> nodes = new ArrayList<>();
        List<String> variableNodeIds = new ArrayList<>();
        Set<String> usedNodeIds = new HashSet<>();
        Set<String> relevantFormulas = new LinkedHashSet<>();
        for (VariableUsage variable : shown) {
            String nodeId = "var_" + sanitizeId(variable.getSymbol());
            if (!usedNodeIds.add(nodeId)) {
                // non-ASCII symbols can collapse to the same sanitized id
                nodeId = nodeId + "_" + variableNodeIds.size();
                usedNodeIds.add(nodeId);
            }
            variableNodeIds.add(nodeId);
            nodes.add(DiagramNode.builder()
                .id(nodeId)
                .label(variable.getSymbol())
                .shape(NodeShape.CIRCLE)
                .fillColor(variable.isDefined() ? DEFINED_FILL : UNDEFINED_FILL)
                .strokeColor(variable.isDefined() ? DEFINED_STROKE : UNDEFINED_STROKE)
                .build());
            relevantFormulas.addAll(firstUses(variable));
        }

        for (Formula formula : formulas) {
            if (relevantFormulas.contains(formula.getId())) {
                nodes.add(DiagramNode.builder()
                    .id(sanitizeId(formula.getId()))
                    .label(formula.getDisplayName())
                    .shape(NodeShape.RECTANGLE)
                    .role(formula.getRole())
                    .fillColor(FORMULA_FILL)
                    .strokeColor(FORMULA_STROKE)
                    .build());
            }
        }
        Set<String> formulaNodeIds = new HashSet<>();
        formulas.forEach(f -> formulaNodeIds.add(sanitizeId(f.getId())));

        List<DiagramEdge> edges = new ArrayList<>();
        for (int i = 0; i < shown.size(); i++) {
            VariableUsage variable = shown.get(i);
            for (String formulaId : firstUses(variable)) {
                String target = sanitizeId(formulaId);
                if (!formulaNodeIds.contains(target)) {
                    continue;
                }
                edges.add(DiagramEdge.builder()
                    .from(variableNodeIds.get(i))
                    .to(target)
                    .style(variable.getDefinedIn().contains(formulaId) ? EdgeStyle.THICK : EdgeStyle.DOTTED)
                    .arrow(EdgeArrow.NORMAL)
                    .build());
            }
        }

        return new DiagramGraph(DiagramDirection.LR, "Variables", nodes, edges, List.of());
    }

    private DiagramNode formulaNode(Formula formula, int previewLength) {
        FormulaRole role = formula.getRole() != null ? formula.getRole() : FormulaRole.UNKNOWN;
        return DiagramNode.builder()
            .id(sanitizeId(formula.getId()))
            .label(formula.getDisplayName() + "\n" + preview(formula.getLatex(), previewLength))
            .shape(NodeShape.ROUNDED)
            .role(role)
            .fillColor(role.getColor())
            .strokeColor(STROKE_COLOR)
            .build();
    }

    private static List<String> firstUses(VariableUsage variable) {
        return variable.getUsedIn().subList(0, Math.min(MAX_FORMULAS_PER_VARIABLE, variable.getUsedIn().size()));
    }

    private static String edgeLabel(FormulaDependency dependency) {
        List<String> shared = dependency.getSharedVariables();
        if (shared == null || shared.isEmpty()) {
            return dependency.getType() != DependencyType.USES_VARIABLE ? dependency.getType().getValue() : null;
        }
        return String.join(", ", shared.subList(0, Math.min(MAX_EDGE_LABEL_VARIABLES, shared.size())));
    }

    static String preview(String latex, int length) {
        if (latex == null) {
            return "";
        }
        return latex.length() > length ? latex.substring(0, length) + "..." : latex;
    }

    /**
     * Maps an arbitrary ID to {@code [A-Za-z0-9_]+}, never starting with a digit.
     */
    public static String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^A-Za-z0-9_]", "_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }
}
