package com.notegraph.core.service.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.config.NoteGraphConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.persistence.store.FileBytesStore;
import com.notegraph.core.service.persistence.store.FileTextStore;
import com.notegraph.core.service.persistence.store.StorageDestinations;
import com.notegraph.core.service.search.index.InMemoryRetrievalIndex;
import com.notegraph.core.service.search.index.IndexedDocument;
import com.notegraph.core.service.search.signal.RecentOpenTracker;
import com.notegraph.core.service.support.GraphFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotRestorerTest {

    @TempDir
    Path directory;

    private ObjectMapper objectMapper;
    private StorageDestinations destinations;
    private NoteGraphConfig config;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        destinations = new StorageDestinations()
                .text(StorageDomain.GRAPH, new FileTextStore(directory.resolve("graph.json")))
                .text(StorageDomain.VECTOR_INDEX, new FileTextStore(directory.resolve("index.json")))
                .bytes(StorageDomain.RELATIONAL_METADATA, new FileBytesStore(directory.resolve("signals.bin")));
        config = new NoteGraphConfig();
    }

    @Test
    @DisplayName("Exported domains are restored into fresh stores")
    void exportThenRestore() {
        var source = new Stores();
        GraphFixtures.document(source.graph, "a.md");
        GraphFixtures.document(source.graph, "b.md");
        GraphFixtures.related(source.graph, "a.md", "b.md");
        source.index.upsert(IndexedDocument.builder().id("a.md").path("a.md").content("alpha").build());
        source.tracker.recordOpen("a.md");
        writeAll(source);

        var target = new Stores();
        restorer(target).restoreAll();

        assertThat(target.graph.stats()).isEqualTo(source.graph.stats());
        assertThat(target.graph.getRelatedFilePaths("a.md", 1)).containsExactly("b.md");
        assertThat(target.index.size()).isEqualTo(1);
        assertThat(target.tracker.getSignalsForPaths(List.of("a.md"))).containsOnlyKeys("a.md");
    }

    @Test
    @DisplayName("A corrupt domain starts empty without blocking the others")
    void corruptDomainStartsEmpty() throws Exception {
        var source = new Stores();
        source.tracker.recordOpen("a.md");
        writeAll(source);
        Files.writeString(directory.resolve("graph.json"), "{not json");

        var target = new Stores();
        GraphFixtures.document(target.graph, "existing.md");
        restorer(target).restoreAll();

        assertThat(target.graph.getNode("existing.md")).isPresent();
        assertThat(target.tracker.size()).isEqualTo(1);
    }

    @Test
    void missingSnapshotsLeaveStoresEmpty() {
        var target = new Stores();

        restorer(target).restoreAll();

        assertThat(target.graph.stats().nodeCount()).isZero();
        assertThat(target.index.size()).isZero();
        assertThat(target.tracker.size()).isZero();
    }

    @Test
    @DisplayName("The graph snapshot is ignored for the Neo4j backend")
    void neo4jBackendSkipsGraph() {
        var source = new Stores();
        GraphFixtures.document(source.graph, "a.md");
        writeAll(source);
        config.getGraph().setBackend(NoteGraphConfig.GraphBackend.NEO4J);

        var target = new Stores();
        restorer(target).restoreAll();

        assertThat(target.graph.stats().nodeCount()).isZero();
    }

    @Test
    void disabledRestoreDoesNothing() {
        var source = new Stores();
        source.tracker.recordOpen("a.md");
        writeAll(source);
        config.getFeatures().setSnapshotRestoreEnabled(false);

        var target = new Stores();
        restorer(target).run(null);

        assertThat(target.tracker.size()).isZero();
    }

    private void writeAll(Stores source) {
        var exporter = new DefaultStorageExporter(source.graph, source.index, source.tracker, objectMapper);
        exporter.export(Set.of(StorageDomain.values())).join()
                .forEach(destinations::write);
    }

    private SnapshotRestorer restorer(Stores target) {
        return new SnapshotRestorer(destinations, target.graph, target.index, target.tracker, objectMapper, config);
    }

    private class Stores {
        final RelationshipStore graph = GraphFixtures.inMemoryStore();
        final InMemoryRetrievalIndex index =
                new InMemoryRetrievalIndex(objectMapper, new MetricsConfig(new SimpleMeterRegistry()));
        final RecentOpenTracker tracker = new RecentOpenTracker(objectMapper, Clock.systemUTC());
    }
}
