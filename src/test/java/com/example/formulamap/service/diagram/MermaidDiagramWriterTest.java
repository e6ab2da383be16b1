package com.example.formulamap.service.diagram;

import com.example.formulamap.dto.diagram.DiagramDirection;
import com.example.formulamap.dto.diagram.DiagramEdge;
import com.example.formulamap.dto.diagram.DiagramGraph;
import com.example.formulamap.dto.diagram.DiagramNode;
import com.example.formulamap.dto.diagram.DiagramSubgraph;
import com.example.formulamap.dto.diagram.EdgeArrow;
import com.example.formulamap.dto.diagram.EdgeStyle;
import com.example.formulamap.dto.diagram.NodeShape;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MermaidDiagramWriterTest {

    private final MermaidDiagramWriter writer = new MermaidDiagramWriter();

    @Test
    void writesSubgraphsBeforeLooseNodesThenEdgesAndStyles() {
        DiagramNode a = DiagramNode.builder().id("eq1").label("eq1\nx = 1").shape(NodeShape.ROUNDED)
            .fillColor("#e3f2fd").strokeColor("#333").build();
        DiagramNode b = DiagramNode.builder().id("eq2").label("eq2").shape(NodeShape.RECTANGLE).build();
        DiagramGraph graph = new DiagramGraph(DiagramDirection.LR, null, List.of(a, b),
            List.of(DiagramEdge.builder().from("eq1").to("eq2").label("x").style(EdgeStyle.SOLID)
                .arrow(EdgeArrow.NORMAL).build()),
            List.of(new DiagramSubgraph("cluster_definition", "Definition", List.of("eq1"))));

        String mermaid = writer.write(graph);

        assertThat(mermaid).isEqualTo(String.join("\n",
            "flowchart LR",
            "    subgraph cluster_definition[\"Definition\"]",
            "        eq1(\"eq1<br/>x = 1\")",
            "    end",
            "    eq2[\"eq2\"]",
            "    eq1 -- \"x\" --> eq2",
            "    style eq1 fill:#e3f2fd,stroke:#333,stroke-width:1px"));
    }

    @Test
    void nodeShapes() {
        assertThat(writer.formatNode(node("a", NodeShape.CIRCLE))).isEqualTo("a((\"a\"))");
        assertThat(writer.formatNode(node("a", NodeShape.DIAMOND))).isEqualTo("a{\"a\"}");
        assertThat(writer.formatNode(node("a", NodeShape.HEXAGON))).isEqualTo("a{{\"a\"}}");
        assertThat(writer.formatNode(node("a", NodeShape.STADIUM))).isEqualTo("a([\"a\"])");
        assertThat(writer.formatNode(node("a", null))).isEqualTo("a[\"a\"]");
    }

    @Test
    void edgeStylesAndArrows() {
        assertThat(writer.formatEdge(edge(EdgeStyle.DOTTED, null, EdgeArrow.NORMAL))).isEqualTo("a -.-> b");
        assertThat(writer.formatEdge(edge(EdgeStyle.DOTTED, "y", EdgeArrow.NORMAL))).isEqualTo("a -. \"y\" .-> b");
        assertThat(writer.formatEdge(edge(EdgeStyle.THICK, null, EdgeArrow.NORMAL))).isEqualTo("a ==> b");
        assertThat(writer.formatEdge(edge(EdgeStyle.THICK, "y", EdgeArrow.NORMAL))).isEqualTo("a == \"y\" ==> b");
        assertThat(writer.formatEdge(edge(EdgeStyle.SOLID, null, EdgeArrow.NONE))).isEqualTo("a --- b");
        assertThat(writer.formatEdge(edge(EdgeStyle.SOLID, null, EdgeArrow.BOTH))).isEqualTo("a <--> b");
    }

    @Test
    void escapesLabelCharacters() {
        assertThat(MermaidDiagramWriter.escapeLabel("a \"<b>\"\nc")).isEqualTo("a '&lt;b&gt;'<br/>c");
    }

    @Test
    void wrapsInFencedBlock() {
        assertThat(writer.wrapInMarkdown("flowchart TB")).isEqualTo("```mermaid\nflowchart TB\n```");
    }

    private static DiagramNode node(String id, NodeShape shape) {
        return DiagramNode.builder().id(id).label(id).shape(shape).build();
    }

    private static DiagramEdge edge(EdgeStyle style, String label, EdgeArrow arrow) {
        return DiagramEdge.builder().from("a").to("b").label(label).style(style).arrow(arrow).build();
    }
}
