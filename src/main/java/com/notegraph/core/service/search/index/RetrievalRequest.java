package com.notegraph.core.service.search.index;

import com.notegraph.core.service.search.RetrievalMode;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * A single retrieval call: either full-text over {@code fields} or vector similarity.
 */
@Builder
public record RetrievalRequest(
        RetrievalMode mode,
        String term,
        float[] embedding,
        List<String> fields,
        Map<String, Double> boosts,
        int limit
) {

    public RetrievalRequest {
        fields = fields == null ? List.of() : List.copyOf(fields);
        boosts = boosts == null ? Map.of() : Map.copyOf(boosts);
    }
}
