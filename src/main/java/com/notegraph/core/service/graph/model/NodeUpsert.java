package com.notegraph.core.service.graph.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Input for an insert-or-update of a node. Timestamps are assigned by the store.
 */
@Builder
public record NodeUpsert(String id, NodeType type, String label, NodeAttributes attributes) {

    public NodeUpsert {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (label == null) {
            label = id;
        }
        if (attributes == null) {
            attributes = NodeAttributes.emptyFor(type);
        }
    }
}
