package com.notegraph.core.service.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.graph.extract.MarkdownContentExtractor;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.EdgeUpsert;
import com.notegraph.core.service.graph.model.GraphNode;
import com.notegraph.core.service.graph.model.GraphPreview.PreviewNode;
import com.notegraph.core.service.graph.model.MarkdownDocument;
import com.notegraph.core.service.graph.model.NodeAttributes.DocumentAttributes;
import com.notegraph.core.service.graph.model.NodeAttributes.LinkAttributes;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.graph.model.NodeUpsert;
import com.notegraph.core.service.graph.model.PreviewRequest;
import com.notegraph.core.service.graph.storage.AttributeCodec;
import com.notegraph.core.service.graph.storage.GraphRepository;
import com.notegraph.core.service.graph.storage.InMemoryGraphRepository;
import com.notegraph.core.service.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DefaultRelationshipStoreTest {

    private MutableClock clock;
    private GraphRepository repository;
    private DefaultRelationshipStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        repository = spy(new InMemoryGraphRepository(new MetricsConfig(new SimpleMeterRegistry())));
        store = new DefaultRelationshipStore(
                repository, new MarkdownContentExtractor(), new AttributeCodec(new ObjectMapper()), clock);
    }

    // ==================== Nodes ====================

    @Test
    @DisplayName("Repeated node upserts keep one row and the original creation time")
    void upsertNodeKeepsCreatedAt() {
        var first = store.upsertNode(document("a.md"));
        clock.advance(Duration.ofMinutes(5));
        var second = store.upsertNode(NodeUpsert.builder()
                .id("a.md")
                .type(NodeType.DOCUMENT)
                .label("renamed")
                .build());

        assertThat(store.getNodesByType(NodeType.DOCUMENT)).hasSize(1);
        assertThat(second.createdAt()).isEqualTo(first.createdAt());
        assertThat(second.updatedAt()).isAfter(first.updatedAt());
        assertThat(store.getNode("a.md").map(GraphNode::label)).contains("renamed");
    }

    @Test
    @DisplayName("Deleting a node removes its incoming and outgoing edges")
    void deleteNodeCascades() {
        store.upsertNode(document("a.md"));
        store.upsertNode(document("b.md"));
        store.upsertNode(document("c.md"));
        store.upsertEdge(edge("a.md", "b.md", EdgeType.RELATED));
        store.upsertEdge(edge("b.md", "c.md", EdgeType.RELATED));

        store.deleteNode("b.md");

        assertThat(store.getNode("b.md")).isEmpty();
        assertThat(store.getOutgoingEdges("b.md")).isEmpty();
        assertThat(store.getIncomingEdges("b.md")).isEmpty();
        assertThat(store.getOutgoingEdges("a.md")).isEmpty();
        assertThat(store.stats()).isEqualTo(new GraphStats(2, 0));
    }

    // ==================== Edges ====================

    @Test
    @DisplayName("N upserts of the same edge accumulate N times the weight")
    void upsertEdgeAccumulatesWeight() {
        store.upsertNode(document("a.md"));
        store.upsertNode(document("b.md"));

        var first = store.upsertEdge(edgeWithWeight("a.md", "b.md", 0.5));
        clock.advance(Duration.ofSeconds(30));
        store.upsertEdge(edgeWithWeight("a.md", "b.md", 0.5));
        var third = store.upsertEdge(edgeWithWeight("a.md", "b.md", 0.5));

        assertThat(third.weight()).isEqualTo(1.5);
        assertThat(third.id()).isEqualTo(first.id());
        assertThat(third.createdAt()).isEqualTo(first.createdAt());
        assertThat(store.getOutgoingEdges("a.md")).hasSize(1);
    }

    @Test
    @DisplayName("Different edge types between the same pair are separate edges")
    void multigraphEdges() {
        store.upsertNode(document("a.md"));
        store.upsertNode(document("b.md"));
        store.upsertEdge(edge("a.md", "b.md", EdgeType.RELATED));
        store.upsertEdge(edge("a.md", "b.md", EdgeType.DEPENDS_ON));

        assertThat(store.getOutgoingEdges("a.md")).hasSize(2);
        assertThat(store.deleteEdge("a.md", "b.md", EdgeType.RELATED)).isTrue();
        assertThat(store.getEdge("a.md", "b.md", EdgeType.DEPENDS_ON)).isPresent();
        assertThat(store.getEdge("a.md", "b.md", EdgeType.RELATED)).isEmpty();
    }

    @Test
    @DisplayName("An edge to a missing node is rejected and leaves no trace in traversal")
    void upsertEdgeRequiresEndpoints() {
        store.upsertNode(document("a.md"));

        assertThatThrownBy(() -> store.upsertEdge(edge("a.md", "ghost.md", EdgeType.RELATED)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.upsertEdge(edge("ghost.md", "a.md", EdgeType.RELATED)))
                .isInstanceOf(IllegalStateException.class);

        assertThat(store.getOutgoingEdges("a.md")).isEmpty();
        assertThat(store.getIncomingEdges("a.md")).isEmpty();
        assertThat(store.getNeighborIds("a.md")).isEmpty();
        assertThat(store.getRelatedNodeIds("a.md")).isEmpty();
        assertThat(store.stats()).isEqualTo(new GraphStats(1, 0));
    }

    // ==================== Traversal ====================

    @Test
    @DisplayName("A->B->C yields {B} at one hop and {B, C} at two hops")
    void relatedNodeIdsByHops() {
        chain("a.md", "b.md", "c.md");

        assertThat(store.getRelatedNodeIds("a.md", 1)).containsExactly("b.md");
        assertThat(store.getRelatedNodeIds("a.md", 2)).containsExactly("b.md", "c.md");
        assertThat(store.getRelatedNodeIds("a.md")).containsExactly("b.md", "c.md");
    }

    @Test
    @DisplayName("Neighbor ids are the direct outgoing targets only")
    void neighborIds() {
        chain("a.md", "b.md", "c.md");

        assertThat(store.getNeighborIds("a.md")).containsExactly("b.md");
        assertThat(store.getNeighborIds("c.md")).isEmpty();
    }

    @Test
    @DisplayName("Traversal issues one neighbor lookup per hop and stops on an empty frontier")
    void traversalIsBatchedPerHop() {
        chain("a.md", "b.md", "c.md");

        store.getRelatedNodeIds("a.md", 5);

        // hop 1: {a}, hop 2: {b}, hop 3: {c} yields nothing and ends the loop
        verify(repository, times(3)).findNeighborIdsMap(anyCollection());
    }

    @Test
    @DisplayName("Related file paths only contain document nodes")
    void relatedFilePathsFilterDocuments() {
        store.upsertMarkdownDocument(MarkdownDocument.builder()
                .id("a.md").path("a.md").content("see #topic").docType("markdown").build());
        store.upsertNode(document("b.md"));
        store.upsertEdge(edge("a.md", "b.md", EdgeType.RELATED));

        assertThat(store.getRelatedNodeIds("a.md")).containsExactlyInAnyOrder("tag:topic", "b.md");
        assertThat(store.getRelatedFilePaths("a.md")).containsExactly("b.md");
    }

    // ==================== Documents ====================

    @Test
    @DisplayName("Markdown documents project links, tags and categories into the graph")
    void upsertMarkdownDocument() {
        store.upsertMarkdownDocument(MarkdownDocument.builder()
                .id("notes/a.md")
                .path("notes/a.md")
                .content("Links to [[Project X|the project]] and #research #ideas")
                .docType("markdown")
                .categories(List.of("work"))
                .build());

        var document = store.getNode("notes/a.md").orElseThrow();
        assertThat(document.attributes()).isEqualTo(new DocumentAttributes("notes/a.md", "markdown"));

        var link = store.getNode("link:Project X").orElseThrow();
        assertThat(link.type()).isEqualTo(NodeType.LINK);
        assertThat(link.attributes()).isEqualTo(new LinkAttributes("Project X", false));

        assertThat(store.getEdge("notes/a.md", "link:Project X", EdgeType.REFERENCES)).isPresent();
        assertThat(store.getEdge("notes/a.md", "tag:research", EdgeType.TAGGED)).isPresent();
        assertThat(store.getEdge("notes/a.md", "tag:ideas", EdgeType.TAGGED)).isPresent();
        assertThat(store.getEdge("notes/a.md", "category:work", EdgeType.CATEGORIZED)).isPresent();
    }

    @Test
    @DisplayName("Removing a document keeps its tag nodes")
    void removeDocumentKeepsTags() {
        store.upsertMarkdownDocument(MarkdownDocument.builder()
                .id("a.md").path("a.md").content("#keep").build());

        store.removeDocument("a.md");

        assertThat(store.getNode("a.md")).isEmpty();
        assertThat(store.getNode("tag:keep")).isPresent();
        assertThat(store.getIncomingEdges("tag:keep")).isEmpty();
        assertThat(store.findOrphanNodeIds(10)).containsExactly("tag:keep");
    }

    // ==================== Preview ====================

    @Test
    @DisplayName("Preview of an unknown node is empty")
    void previewOfUnknownNode() {
        var preview = store.getPreview(PreviewRequest.of("missing.md"));

        assertThat(preview.nodes()).isEmpty();
        assertThat(preview.edges()).isEmpty();
    }

    @Test
    @DisplayName("Preview labels tags with # and only keeps edges between emitted nodes")
    void previewRespectsLimits() {
        store.upsertMarkdownDocument(MarkdownDocument.builder()
                .id("a.md").path("a.md").content("#alpha").build());
        store.upsertNode(document("b.md"));
        store.upsertNode(document("c.md"));
        store.upsertEdge(edge("a.md", "b.md", EdgeType.RELATED));
        store.upsertEdge(edge("b.md", "c.md", EdgeType.RELATED));

        var preview = store.getPreview(PreviewRequest.builder()
                .startNodeId("a.md")
                .maxNodes(3)
                .maxHops(2)
                .build());

        assertThat(preview.nodes()).extracting(PreviewNode::id).containsExactly("a.md", "tag:alpha", "b.md");
        assertThat(preview.nodes()).extracting(PreviewNode::label).contains("#alpha");
        assertThat(preview.edges()).allSatisfy(edge -> {
            assertThat(List.of("a.md", "tag:alpha", "b.md")).contains(edge.from(), edge.to());
        });
        assertThat(preview.edges()).hasSize(2);
    }

    // ==================== Snapshots ====================

    @Test
    @DisplayName("Restore replaces the graph with the snapshot content")
    void snapshotAndRestore() {
        chain("a.md", "b.md");
        var snapshot = store.snapshot();

        store.upsertNode(document("extra.md"));
        store.restore(snapshot);

        assertThat(store.getNode("extra.md")).isEmpty();
        assertThat(store.getEdge("a.md", "b.md", EdgeType.RELATED)).isPresent();
        assertThat(store.stats()).isEqualTo(new GraphStats(2, 1));
    }

    @Test
    @DisplayName("A snapshot with a dangling edge leaves the graph empty")
    void restoreRejectsDanglingEdges() {
        chain("a.md", "b.md");
        var snapshot = store.snapshot();
        var broken = new GraphSnapshot(snapshot.nodes().subList(0, 1), snapshot.edges());

        assertThatThrownBy(() -> store.restore(broken)).isInstanceOf(IllegalStateException.class);
        assertThat(store.stats()).isEqualTo(new GraphStats(0, 0));
    }

    // ==================== Helper Methods ====================

    private void chain(String... ids) {
        for (var id : ids) {
            store.upsertNode(document(id));
        }
        for (int i = 0; i + 1 < ids.length; i++) {
            store.upsertEdge(edge(ids[i], ids[i + 1], EdgeType.RELATED));
        }
    }

    private static NodeUpsert document(String id) {
        return NodeUpsert.builder()
                .id(id)
                .type(NodeType.DOCUMENT)
                .label(id)
                .attributes(new DocumentAttributes(id, "markdown"))
                .build();
    }

    private static EdgeUpsert edge(String from, String to, EdgeType type) {
        return EdgeUpsert.builder().fromNodeId(from).toNodeId(to).type(type).build();
    }

    private static EdgeUpsert edgeWithWeight(String from, String to, double weight) {
        return EdgeUpsert.builder().fromNodeId(from).toNodeId(to).type(EdgeType.RELATED).weight(weight).build();
    }
}
