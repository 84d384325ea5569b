package com.notegraph.core.service.graph.storage;

import java.time.Instant;

/**
 * Stored shape of an edge.
 */
public record EdgeRow(
        String id,
        String fromNodeId,
        String toNodeId,
        String type,
        double weight,
        String attributes,
        Instant createdAt,
        Instant updatedAt
) {

    public EdgeRow withWeight(double newWeight, Instant touchedAt) {
        return new EdgeRow(id, fromNodeId, toNodeId, type, newWeight, attributes, createdAt, touchedAt);
    }
}
