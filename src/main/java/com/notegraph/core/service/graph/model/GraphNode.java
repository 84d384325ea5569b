package com.notegraph.core.service.graph.model;

import java.time.Instant;

/**
 * A vertex of the relationship graph, with its attributes decoded into the variant for its type.
 */
public record GraphNode(
        String id,
        NodeType type,
        String label,
        NodeAttributes attributes,
        Instant createdAt,
        Instant updatedAt
) {
}
