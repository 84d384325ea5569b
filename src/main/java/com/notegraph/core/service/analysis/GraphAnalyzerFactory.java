package com.notegraph.core.service.analysis;

import com.notegraph.core.service.graph.RelationshipStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh analyzer per operation.
 */
@Component
@RequiredArgsConstructor
public class GraphAnalyzerFactory {

    private final RelationshipStore store;

    public InMemoryGraphAnalyzer create() {
        return new InMemoryGraphAnalyzer(store);
    }
}
