package com.notegraph.core.service.graph.storage;

import com.notegraph.core.service.config.NoteGraphConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the repository contract against a real Neo4j server. Skipped without Docker.
 */
@Testcontainers(disabledWithoutDocker = true)
class Neo4jGraphRepositoryTest {

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.15.0")
            .withoutAuthentication();

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    private static Driver driver;
    private static Neo4jGraphRepository repository;

    @BeforeAll
    static void connect() {
        driver = GraphDatabase.driver(neo4jContainer.getBoltUrl(), AuthTokens.none());
        var config = new NoteGraphConfig();
        config.getNeo4j().setUri(neo4jContainer.getBoltUrl());
        repository = new Neo4jGraphRepository(driver, config);
        repository.init();
    }

    @AfterAll
    static void disconnect() {
        driver.close();
    }

    @BeforeEach
    void cleanup() {
        repository.clear();
    }

    @Test
    @DisplayName("Saving a node twice keeps a single row with the latest values")
    void saveNodeIsAnUpsert() {
        repository.saveNode(node("a", "first"));
        repository.saveNode(node("a", "second"));

        assertThat(repository.countNodes()).isEqualTo(1);
        var stored = repository.findNodeById("a").orElseThrow();
        assertThat(stored.label()).isEqualTo("second");
        assertThat(stored.createdAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Edges round-trip with weight and are reachable by either endpoint")
    void edgesByEndpoint() {
        List.of("a", "b", "c").forEach(id -> repository.saveNode(node(id, id)));
        repository.saveEdge(edge("e1", "a", "b", 1.0));
        repository.saveEdge(edge("e2", "a", "c", 2.5));

        assertThat(repository.findEdgeById("e2")).get()
                .extracting(EdgeRow::weight).isEqualTo(2.5);
        assertThat(repository.findEdgesByToNode("b")).extracting(EdgeRow::fromNodeId).containsExactly("a");
        assertThat(repository.findNeighborIdsMap(List.of("a", "b")).get("a")).containsExactlyInAnyOrder("b", "c");
        assertThat(repository.findIdsByIdsAndTypes(Set.of("a", "b"), List.of("document")))
                .containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @DisplayName("Deleting by endpoint removes the edges and reports the count")
    void deleteEdgesByEndpoint() {
        List.of("a", "b").forEach(id -> repository.saveNode(node(id, id)));
        repository.saveEdge(edge("e1", "a", "b", 1.0));

        assertThat(repository.deleteEdgesByFromNode("a")).isEqualTo(1);
        assertThat(repository.countEdges()).isZero();
        assertThat(repository.findOrphanNodeIds(10)).containsExactly("a", "b");
        assertThat(repository.deleteNodeById("a")).isTrue();
        assertThat(repository.deleteNodeById("a")).isFalse();
    }

    @Test
    @DisplayName("An edge needs both endpoint nodes")
    void edgeRequiresEndpoints() {
        repository.saveNode(node("a", "a"));

        assertThatThrownBy(() -> repository.saveEdge(edge("e1", "a", "missing", 1.0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Edges come back in creation order across whole and fractional seconds")
    void edgesOrderedChronologically() {
        List.of("a", "b", "c").forEach(id -> repository.saveNode(node(id, id)));
        var whole = Instant.parse("2024-05-01T10:00:00Z");
        var later = Instant.parse("2024-05-01T10:00:00.500Z");
        repository.saveEdge(new EdgeRow("z-first", "a", "b", "related", 1.0, "{}", whole, whole));
        repository.saveEdge(new EdgeRow("a-second", "a", "c", "related", 1.0, "{}", later, later));

        assertThat(repository.findEdgesByFromNode("a")).extracting(EdgeRow::id)
                .containsExactly("z-first", "a-second");
        assertThat(repository.findNeighborIdsMap(List.of("a")).get("a")).containsExactly("b", "c");
    }

    private static NodeRow node(String id, String label) {
        return new NodeRow(id, "document", label, "{}", NOW, NOW);
    }

    private static EdgeRow edge(String id, String from, String to, double weight) {
        return new EdgeRow(id, from, to, "related", weight, "{}", NOW, NOW);
    }
}
