package com.example.formulamap.service.diagram;

import com.example.formulamap.dto.diagram.DiagramEdge;
import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.diagram.DiagramNode;
import com.example.formulamap.dto.diagram.DiagramSubgraph;
import com.example.formulamap.dto.diagram.EdgeArrow;
import com.example.formulamap.dto.diagram.EdgeStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes Mermaid flowchart syntax.
 */
@Component
public class MermaidDiagramWriter implements DiagramSyntaxWriter {

    private static final String INDENT = "    ";

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String write(DiagramGraph graph) {
        StringBuilder out = new StringBuilder();
        out.append("flowchart ").append(graph.getDirection().name());

        Set<String> inSubgraph = new HashSet<>();
        for (DiagramSubgraph subgraph : graph.getSubgraphs()) {
            line(out, INDENT, "subgraph " + subgraph.getId() + "[\"" + escapeLabel(subgraph.getLabel()) + "\"]");
            for (String nodeId : subgraph.getNodes()) {
                graph.findNode(nodeId).ifPresent(node -> line(out, INDENT + INDENT, formatNode(node)));
                inSubgraph.add(nodeId);
            }
            line(out, INDENT, "end");
        }

        for (DiagramNode node : graph.getNodes()) {
            if (!inSubgraph.contains(node.getId())) {
                line(out, INDENT, formatNode(node));
            }
        }

        for (DiagramEdge edge : graph.getEdges()) {
            line(out, INDENT, formatEdge(edge));
        }

        for (DiagramNode node : graph.getNodes()) {
            String style = formatStyle(node);
            if (style != null) {
                line(out, INDENT, "style " + node.getId() + " " + style);
            }
        }

        return out.toString();
    }

    @Override
    public String wrapInMarkdown(String diagram) {
        return "```mermaid\n" + diagram + "\n```";
    }

    String formatNode(DiagramNode node) {
        String label = escapeLabel(node.getLabel());
        if (node.getShape() == null) {
            return node.getId() + "[\"" + label + "\"]";
        }
        switch (node.getShape()) {
            case ROUNDED:
                return node.getId() + "(\"" + label + "\")";
            case CIRCLE:
                return node.getId() + "((\"" + label + "\"))";
            case DIAMOND:
                return node.getId() + "{\"" + label + "\"}";
            case HEXAGON:
                return node.getId() + "{{\"" + label + "\"}}";
            case STADIUM:
                return node.getId() + "([\"" + label + "\"])";
            case RECTANGLE:
            default:
                return node.getId() + "[\"" + label + "\"]";
        }
    }

    String formatEdge(DiagramEdge edge) {
        EdgeStyle style = edge.getStyle() != null ? edge.getStyle() : EdgeStyle.SOLID;
        boolean labelled = edge.getLabel() != null && !edge.getLabel().isEmpty();
        String label = labelled ? "\"" + escapeLabel(edge.getLabel()) + "\"" : null;

        String arrow;
        switch (style) {
            case DOTTED:
                arrow = labelled ? "-. " + label + " .->" : "-.->";
                break;
            case THICK:
                arrow = labelled ? "== " + label + " ==>" : "==>";
                break;
            case SOLID:
            default:
                arrow = labelled ? "-- " + label + " -->" : "-->";
                break;
        }

        if (edge.getArrow() == EdgeArrow.NONE) {
            arrow = stripHead(arrow);
        } else if (edge.getArrow() == EdgeArrow.BOTH) {
            arrow = "<" + arrow;
        }
        return edge.getFrom() + " " + arrow + " " + edge.getTo();
    }

    private static String stripHead(String arrow) {
        if (arrow.endsWith(".->")) {
            return arrow.substring(0, arrow.length() - 3) + ".-";
        }
        if (arrow.endsWith("==>")) {
            return arrow.substring(0, arrow.length() - 3) + "===";
        }
        return arrow.substring(0, arrow.length() - 3) + "---";
    }

    private static String formatStyle(DiagramNode node) {
        if (node.getFillColor() == null && node.getStrokeColor() == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (node.getFillColor() != null) {
            parts.add("fill:" + node.getFillColor());
        }
        if (node.getStrokeColor() != null) {
            parts.add("stroke:" + node.getStrokeColor());
        }
        parts.add("stroke-width:1px");
        return String.join(",", parts);
    }

    static String escapeLabel(String label) {
        if (label == null) {
            return "";
        }
        return label
            .replace("\"", "'")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\n", "<br/>");
    }

    private static void line(StringBuilder out, String indent, String text) {
        out.append('\n').append(indent).append(text);
    }
}
