package com.notegraph.core.service.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.config.NoteGraphConfig;
import com.notegraph.core.service.graph.GraphSnapshot;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.persistence.store.StorageDestinations;
import com.notegraph.core.service.search.index.RetrievalIndex;
import com.notegraph.core.service.search.signal.RecentOpenTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Loads the persisted snapshots into the in-memory stores at startup.
 *
 * A domain whose snapshot is missing or unreadable starts empty. The graph snapshot is
 * skipped for the Neo4j backend, which keeps its own data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotRestorer implements ApplicationRunner {

    private final StorageDestinations destinations;
    private final RelationshipStore relationshipStore;
    private final RetrievalIndex retrievalIndex;
    private final RecentOpenTracker recentOpenTracker;
    private final ObjectMapper objectMapper;
    private final NoteGraphConfig noteGraphConfig;

    @Override
    public void run(ApplicationArguments args) {
        if (!noteGraphConfig.getFeatures().isSnapshotRestoreEnabled()) {
            log.info("Snapshot restore is disabled");
            return;
        }
        restoreAll();
    }

    public void restoreAll() {
        for (var domain : StorageDomain.values()) {
            try {
                restore(domain);
            } catch (RuntimeException e) {
                log.warn("Could not restore {} snapshot, starting empty: {}", domain, e.getMessage());
            }
        }
    }

    private void restore(StorageDomain domain) {
        switch (domain) {
            case GRAPH -> restoreGraph();
            case VECTOR_INDEX -> destinations.readText(domain).ifPresent(retrievalIndex::importSnapshot);
            case RELATIONAL_METADATA -> destinations.readBytes(domain).ifPresent(recentOpenTracker::importSnapshot);
        }
    }

    private void restoreGraph() {
        if (noteGraphConfig.getGraph().getBackend() == NoteGraphConfig.GraphBackend.NEO4J) {
            log.info("Graph backend is Neo4j, skipping graph snapshot");
            return;
        }
        destinations.readText(StorageDomain.GRAPH).ifPresent(json -> {
            var snapshot = readGraph(json);
            relationshipStore.restore(snapshot);
            log.info("Restored graph snapshot: {} nodes, {} edges", snapshot.nodes().size(), snapshot.edges().size());
        });
    }

    private GraphSnapshot readGraph(String json) {
        try {
            return objectMapper.readValue(json, GraphSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed graph snapshot", e);
        }
    }
}
