package com.notegraph.core.service.graph.model;

import java.util.List;

/**
 * Bounded subgraph around a start node, ready for display.
 */
public record GraphPreview(List<PreviewNode> nodes, List<PreviewEdge> edges) {

    public static GraphPreview empty() {
        return new GraphPreview(List.of(), List.of());
    }

    public record PreviewNode(String id, String label, NodeType type) {
    }

    public record PreviewEdge(String from, String to, EdgeType type, double weight) {
    }
}
