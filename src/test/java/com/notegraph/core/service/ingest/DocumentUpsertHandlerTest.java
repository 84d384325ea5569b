package com.notegraph.core.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.config.SearchConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.GraphEdge;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.persistence.PersistenceScheduler;
import com.notegraph.core.service.persistence.StorageDomain;
import com.notegraph.core.service.search.RetrievalMode;
import com.notegraph.core.service.search.index.InMemoryRetrievalIndex;
import com.notegraph.core.service.search.index.RetrievalHit;
import com.notegraph.core.service.search.index.RetrievalRequest;
import com.notegraph.core.service.support.GraphFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class DocumentUpsertHandlerTest {

    private RelationshipStore store;
    private InMemoryRetrievalIndex index;
    private PersistenceScheduler persistenceScheduler;
    private MetricsConfig metricsConfig;
    private DocumentUpsertHandler handler;

    @BeforeEach
    void setUp() {
        var searchConfig = new SearchConfig();
        searchConfig.setEmbeddingDimension(3);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        store = GraphFixtures.inMemoryStore();
        index = new InMemoryRetrievalIndex(new ObjectMapper(), metricsConfig);
        persistenceScheduler = mock(PersistenceScheduler.class);
        handler = new DocumentUpsertHandler(store, index, persistenceScheduler, searchConfig, metricsConfig);
    }

    @Test
    @DisplayName("A document is projected into graph and index, then persistence is armed")
    void indexesDocument() {
        handler.handle(new IngestionWorkItem.DocumentUpsertWorkItem(DocumentPayload.builder()
                .path("projects/plan.md")
                .title("Plan")
                .content("See [[Roadmap]] #planning")
                .categories(List.of("work"))
                .embedding(new float[]{1, 0, 0})
                .build()));

        assertThat(store.getNode("projects/plan.md")).isPresent();
        assertThat(store.getOutgoingEdges("projects/plan.md"))
                .extracting(GraphEdge::type)
                .containsExactlyInAnyOrder(EdgeType.REFERENCES, EdgeType.TAGGED, EdgeType.CATEGORIZED);
        assertThat(store.getNodesByType(NodeType.TAG)).hasSize(1);

        var hits = index.search(RetrievalRequest.builder()
                .mode(RetrievalMode.FULLTEXT)
                .term("roadmap")
                .fields(List.of("content"))
                .limit(5)
                .build());
        assertThat(hits).extracting(RetrievalHit::title).containsExactly("Plan");

        verify(persistenceScheduler).schedule(StorageDomain.GRAPH, StorageDomain.VECTOR_INDEX);
        verify(persistenceScheduler).flushWhenIdle();
        assertThat(metricsConfig.getDocumentsIngested().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An embedding of the wrong length is rejected before anything is written")
    void rejectsWrongEmbeddingDimension() {
        var item = new IngestionWorkItem.DocumentUpsertWorkItem(DocumentPayload.builder()
                .path("a.md")
                .embedding(new float[]{1, 0})
                .build());

        assertThatThrownBy(() -> handler.handle(item))
                .isInstanceOfSatisfying(IngestionException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(IngestionException.Reason.INVALID_EMBEDDING);
                    assertThat(e.getDocumentId()).isEqualTo("a.md");
                });
        assertThat(store.getNode("a.md")).isEmpty();
        assertThat(index.size()).isZero();
        verifyNoInteractions(persistenceScheduler);
    }

    @Test
    void storeFailuresAreWrapped() {
        var failingStore = mock(RelationshipStore.class);
        doThrow(new IllegalStateException("graph offline")).when(failingStore).upsertMarkdownDocument(any());
        var failingHandler = new DocumentUpsertHandler(failingStore, index, persistenceScheduler,
                new SearchConfig(), metricsConfig);

        assertThatThrownBy(() -> failingHandler.handle(
                new IngestionWorkItem.DocumentUpsertWorkItem(DocumentPayload.builder().path("a.md").build())))
                .isInstanceOf(IngestionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting("reason").isEqualTo(IngestionException.Reason.UPSERT_FAILED);
    }
}
