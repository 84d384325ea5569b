package com.notegraph.core.service.graph.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Parameters of a preview query.
 */
@Builder
public record PreviewRequest(String startNodeId, Integer maxNodes, Integer maxHops) {

    public static final int DEFAULT_MAX_NODES = 30;
    public static final int DEFAULT_MAX_HOPS = 2;

    public PreviewRequest {
        Objects.requireNonNull(startNodeId, "startNodeId");
        if (maxNodes == null) {
            maxNodes = DEFAULT_MAX_NODES;
        }
        if (maxHops == null) {
            maxHops = DEFAULT_MAX_HOPS;
        }
    }

    public static PreviewRequest of(String startNodeId) {
        return new PreviewRequest(startNodeId, null, null);
    }
}
