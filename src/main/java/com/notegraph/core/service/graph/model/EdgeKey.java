package com.notegraph.core.service.graph.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Composite identity of an edge.
 *
 * The edge id is a name-based UUID over the three components, so extracting the same
 * relationship twice always resolves to the same stored row.
 */
public record EdgeKey(String fromNodeId, String toNodeId, EdgeType type) {

    private static final char SEPARATOR = '\u001F';

    public EdgeKey {
        Objects.requireNonNull(fromNodeId, "fromNodeId");
        Objects.requireNonNull(toNodeId, "toNodeId");
        Objects.requireNonNull(type, "type");
    }

    public String edgeId() {
        var name = fromNodeId + SEPARATOR + toNodeId + SEPARATOR + type.storageName();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
