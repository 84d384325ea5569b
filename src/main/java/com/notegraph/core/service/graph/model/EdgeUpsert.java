package com.notegraph.core.service.graph.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Input for an edge upsert. {@code weight} is the increment added to an existing edge,
 * or the initial weight of a new one.
 */
@Builder
public record EdgeUpsert(String fromNodeId, String toNodeId, EdgeType type, Double weight,
                         EdgeAttributes attributes) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public EdgeUpsert {
        Objects.requireNonNull(fromNodeId, "fromNodeId");
        Objects.requireNonNull(toNodeId, "toNodeId");
        Objects.requireNonNull(type, "type");
        if (weight == null) {
            weight = DEFAULT_WEIGHT;
        }
        if (attributes == null) {
            attributes = EdgeAttributes.emptyFor(type);
        }
    }

    public EdgeKey key() {
        return new EdgeKey(fromNodeId, toNodeId, type);
    }
}
