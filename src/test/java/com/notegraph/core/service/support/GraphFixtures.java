package com.notegraph.core.service.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.graph.DefaultRelationshipStore;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.extract.MarkdownContentExtractor;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.EdgeUpsert;
import com.notegraph.core.service.graph.model.NodeAttributes.DocumentAttributes;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.graph.model.NodeUpsert;
import com.notegraph.core.service.graph.storage.AttributeCodec;
import com.notegraph.core.service.graph.storage.InMemoryGraphRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;

/**
 * Builders for small in-memory graphs.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static RelationshipStore inMemoryStore() {
        return new DefaultRelationshipStore(
                new InMemoryGraphRepository(new MetricsConfig(new SimpleMeterRegistry())),
                new MarkdownContentExtractor(),
                new AttributeCodec(new ObjectMapper()),
                Clock.systemUTC());
    }

    public static void document(RelationshipStore store, String path) {
        store.upsertNode(NodeUpsert.builder()
                .id(path)
                .type(NodeType.DOCUMENT)
                .label(path)
                .attributes(new DocumentAttributes(path, "markdown"))
                .build());
    }

    public static void related(RelationshipStore store, String from, String to) {
        store.upsertEdge(EdgeUpsert.builder()
                .fromNodeId(from)
                .toNodeId(to)
                .type(EdgeType.RELATED)
                .build());
    }
}
