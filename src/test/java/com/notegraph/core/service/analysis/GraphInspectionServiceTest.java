package com.notegraph.core.service.analysis;

import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.GraphNode;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.graph.model.NodeUpsert;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.notegraph.core.service.support.GraphFixtures.document;
import static com.notegraph.core.service.support.GraphFixtures.inMemoryStore;
import static com.notegraph.core.service.support.GraphFixtures.related;
import static org.assertj.core.api.Assertions.assertThat;

class GraphInspectionServiceTest {

    private RelationshipStore store;
    private MetricsConfig metricsConfig;
    private GraphInspectionService service;

    @BeforeEach
    void setUp() {
        store = inMemoryStore();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        service = new GraphInspectionService(new GraphAnalyzerFactory(store), store, metricsConfig);
    }

    @Test
    @DisplayName("Paths ignore edge direction")
    void findPathUndirected() {
        List.of("a", "b", "c").forEach(id -> document(store, id));
        related(store, "a", "b");
        related(store, "c", "b");

        assertThat(service.findPath("a", "c")).contains(List.of("a", "b", "c"));
        assertThat(service.findPath("a", "unknown")).isEmpty();
    }

    @Test
    @DisplayName("Disconnected nodes have no path")
    void findPathDisconnected() {
        List.of("a", "b").forEach(id -> document(store, id));

        assertThat(service.findPath("a", "b")).isEmpty();
    }

    @Test
    @DisplayName("The hub of a star ranks first")
    void keyNodesRankHubFirst() {
        List.of("hub", "x", "y", "z").forEach(id -> document(store, id));
        List.of("x", "y", "z").forEach(leaf -> {
            related(store, "hub", leaf);
            related(store, leaf, "hub");
        });

        var keyNodes = service.findKeyNodes(2);

        assertThat(keyNodes).hasSize(2);
        assertThat(keyNodes.get(0).id()).isEqualTo("hub");
        assertThat(keyNodes.get(0).outDegree()).isEqualTo(3);
        assertThat(keyNodes.get(0).inDegree()).isEqualTo(3);
        assertThat(metricsConfig.getAnalysisBuildTimer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Two separate cliques form two communities")
    void communitiesFollowComponents() {
        List.of("a1", "a2", "a3", "b1", "b2").forEach(id -> document(store, id));
        related(store, "a1", "a2");
        related(store, "a2", "a3");
        related(store, "a3", "a1");
        related(store, "b1", "b2");

        var communities = service.detectCommunities(List.of());

        assertThat(communities).hasSize(2);
        assertThat(communities.get(0)).containsExactlyInAnyOrder("a1", "a2", "a3");
        assertThat(communities.get(1)).containsExactlyInAnyOrder("b1", "b2");
    }

    @Test
    @DisplayName("Orphans are nodes without edges")
    void orphans() {
        document(store, "a");
        document(store, "b");
        store.upsertNode(NodeUpsert.builder().id("tag:lost").type(NodeType.TAG).build());
        related(store, "a", "b");

        assertThat(service.findOrphans(10)).extracting(GraphNode::id).containsExactly("tag:lost");
    }

    @Test
    @DisplayName("An empty graph has no key nodes and no communities")
    void emptyGraph() {
        assertThat(service.findKeyNodes(5)).isEmpty();
        assertThat(service.detectCommunities(null)).isEmpty();
    }
}
