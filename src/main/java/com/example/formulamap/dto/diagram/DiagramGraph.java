package com.example.formulamap.dto.diagram;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Rendering-agnostic node/edge/subgraph model handed to a presentation layer.
 * Collections are copied on construction and never change afterwards.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagramGraph {
    DiagramDirection direction;
    String title;
    List<DiagramNode> nodes;
    List<DiagramEdge> edges;
    List<DiagramSubgraph> subgraphs;

    public DiagramGraph(DiagramDirection direction, String title, List<DiagramNode> nodes,
                        List<DiagramEdge> edges, List<DiagramSubgraph> subgraphs) {
        this.direction = direction != null ? direction : DiagramDirection.TB;
        this.title = title;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.subgraphs = subgraphs != null ? List.copyOf(subgraphs) : List.of();
    }

    public static DiagramGraph empty(DiagramDirection direction) {
        return new DiagramGraph(direction, null, List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public Optional<DiagramNode> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }
}
