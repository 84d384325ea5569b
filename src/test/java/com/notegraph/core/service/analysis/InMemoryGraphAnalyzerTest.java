package com.notegraph.core.service.analysis;

import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.PreviewRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.notegraph.core.service.support.GraphFixtures.document;
import static com.notegraph.core.service.support.GraphFixtures.inMemoryStore;
import static com.notegraph.core.service.support.GraphFixtures.related;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphAnalyzerTest {

    private RelationshipStore store;

    @BeforeEach
    void setUp() {
        store = inMemoryStore();
        List.of("a", "b", "c", "d", "far").forEach(id -> document(store, id));
        related(store, "a", "b");
        related(store, "b", "c");
        related(store, "c", "d");
        related(store, "d", "far");
        related(store, "a", "b");
    }

    @Test
    @DisplayName("getGraph fails before the topology is built")
    void graphNotBuilt() {
        try (var analyzer = new InMemoryGraphAnalyzer(store)) {
            assertThat(analyzer.hasGraph()).isFalse();
            assertThatThrownBy(analyzer::getGraph).isInstanceOf(GraphNotBuiltException.class);
        }
    }

    @Test
    @DisplayName("Without centers every node is loaded")
    void buildWholeGraph() {
        try (var analyzer = new InMemoryGraphAnalyzer(store)) {
            var topology = analyzer.buildGraph();

            assertThat(topology.nodeIds()).containsExactlyInAnyOrder("a", "b", "c", "d", "far");
            assertThat(topology.edgeCount()).isEqualTo(4);
            assertThat(topology.weightBetween("a", "b")).isEqualTo(2.0);
            assertThat(analyzer.getGraph()).isSameAs(topology);
        }
    }

    @Test
    @DisplayName("With centers only the 2-hop neighborhood and edges inside it are loaded")
    void buildNeighborhood() {
        try (var analyzer = new InMemoryGraphAnalyzer(store)) {
            var topology = analyzer.buildGraph(List.of("a"));

            assertThat(topology.nodeIds()).containsExactlyInAnyOrder("a", "b", "c");
            assertThat(topology.edgeCount()).isEqualTo(2);
            assertThat(topology.outDegree("c")).isZero();
        }
    }

    @Test
    @DisplayName("Release is idempotent and drops the topology")
    void releaseIsIdempotent() {
        var analyzer = new InMemoryGraphAnalyzer(store);
        analyzer.buildGraph();

        analyzer.release();
        analyzer.release();

        assertThat(analyzer.hasGraph()).isFalse();
    }

    @Test
    @DisplayName("Metadata is read from the store on every call")
    void metadataIsNotCached() {
        try (var analyzer = new InMemoryGraphAnalyzer(store)) {
            analyzer.buildGraph();
            store.deleteEdge("a", "b", EdgeType.RELATED);

            assertThat(analyzer.getEdgeMetadata("a", "b", EdgeType.RELATED)).isEmpty();
            assertThat(analyzer.getNodeMetadata("a")).isPresent();
            assertThat(analyzer.getGraph().containsNode("a")).isTrue();
        }
    }

    @Test
    @DisplayName("Preview and related documents work without building a graph")
    void delegationsNeedNoTopology() {
        try (var analyzer = new InMemoryGraphAnalyzer(store)) {
            assertThat(analyzer.buildPreview(PreviewRequest.of("a")).nodes()).hasSize(3);
            assertThat(analyzer.getRelatedDocumentIds("a", 1)).containsExactly("b");
            assertThat(analyzer.hasGraph()).isFalse();
        }
    }
}
