package com.notegraph.core.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.graph.DefaultRelationshipStore;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.extract.ContentExtractor;
import com.notegraph.core.service.graph.extract.MarkdownContentExtractor;
import com.notegraph.core.service.graph.storage.AttributeCodec;
import com.notegraph.core.service.graph.storage.GraphRepository;
import com.notegraph.core.service.graph.storage.InMemoryGraphRepository;
import com.notegraph.core.service.graph.storage.Neo4jGraphRepository;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the relationship store onto the configured graph backend.
 */
@Slf4j
@Configuration
public class GraphStorageConfig {

    private static final String BACKEND_PROPERTY = "notegraph.graph.backend";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContentExtractor contentExtractor() {
        return new MarkdownContentExtractor();
    }

    @Bean
    public AttributeCodec attributeCodec(ObjectMapper objectMapper) {
        return new AttributeCodec(objectMapper);
    }

    // ==================== Backends ====================

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "memory", matchIfMissing = true)
    public GraphRepository inMemoryGraphRepository(MetricsConfig metricsConfig) {
        log.info("Using in-memory graph backend");
        return new InMemoryGraphRepository(metricsConfig);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "neo4j")
    public Driver neo4jDriver(NoteGraphConfig noteGraphConfig) {
        var neo4j = noteGraphConfig.getNeo4j();
        log.info("Connecting graph backend to Neo4j at {}", neo4j.getUri());
        return GraphDatabase.driver(neo4j.getUri(), authToken(neo4j));
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "neo4j")
    public GraphRepository neo4jGraphRepository(Driver neo4jDriver, NoteGraphConfig noteGraphConfig) {
        return new Neo4jGraphRepository(neo4jDriver, noteGraphConfig);
    }

    // ==================== Store ====================

    @Bean
    public RelationshipStore relationshipStore(GraphRepository graphRepository,
                                               ContentExtractor contentExtractor,
                                               AttributeCodec attributeCodec,
                                               Clock clock) {
        return new DefaultRelationshipStore(graphRepository, contentExtractor, attributeCodec, clock);
    }

    private static AuthToken authToken(NoteGraphConfig.Neo4jConfig neo4j) {
        if (neo4j.getUsername() == null || neo4j.getUsername().isBlank()) {
            return AuthTokens.none();
        }
        return AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword());
    }
}
