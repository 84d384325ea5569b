package com.notegraph.core.service.graph;

import com.notegraph.core.service.graph.storage.EdgeRow;
import com.notegraph.core.service.graph.storage.NodeRow;

import java.util.List;

/**
 * Complete copy of the stored graph, in row form.
 */
public record GraphSnapshot(List<NodeRow> nodes, List<EdgeRow> edges) {

    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
