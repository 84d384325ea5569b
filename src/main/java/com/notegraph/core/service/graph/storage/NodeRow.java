package com.notegraph.core.service.graph.storage;

import java.time.Instant;

/**
 * Stored shape of a node: type by storage name, attributes as a JSON document.
 */
public record NodeRow(
        String id,
        String type,
        String label,
        String attributes,
        Instant createdAt,
        Instant updatedAt
) {
}
