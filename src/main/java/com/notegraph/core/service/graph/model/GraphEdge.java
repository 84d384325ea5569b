package com.notegraph.core.service.graph.model;

import java.time.Instant;

/**
 * A typed, weighted relationship between two nodes.
 */
public record GraphEdge(
        String id,
        String fromNodeId,
        String toNodeId,
        EdgeType type,
        double weight,
        EdgeAttributes attributes,
        Instant createdAt,
        Instant updatedAt
) {

    public EdgeKey key() {
        return new EdgeKey(fromNodeId, toNodeId, type);
    }
}
