package com.notegraph.core.service.analysis;

import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.GraphEdge;
import com.notegraph.core.service.graph.model.GraphNode;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * On-demand node and edge metadata, read from the relationship store on every call.
 */
@RequiredArgsConstructor
public class GraphMetadataAccessor {

    private final RelationshipStore store;

    public Optional<GraphNode> getNodeMetadata(String nodeId) {
        return store.getNode(nodeId);
    }

    public Optional<GraphEdge> getEdgeMetadata(String fromNodeId, String toNodeId, EdgeType type) {
        return store.getEdge(fromNodeId, toNodeId, type);
    }

    /**
     * Label of the node, or its id when the node is gone.
     */
    public String labelOf(String nodeId) {
        return store.getNode(nodeId)
                .map(GraphNode::label)
                .orElse(nodeId);
    }
}
