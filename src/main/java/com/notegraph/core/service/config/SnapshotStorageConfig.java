package com.notegraph.core.service.config;

import com.notegraph.core.service.ingest.IngestionQueue;
import com.notegraph.core.service.persistence.PersistenceScheduler;
import com.notegraph.core.service.persistence.StorageDomain;
import com.notegraph.core.service.persistence.StorageExporter;
import com.notegraph.core.service.persistence.StoragePersistenceScheduler;
import com.notegraph.core.service.persistence.idle.IdleTaskRunner;
import com.notegraph.core.service.persistence.idle.IngestionIdleTaskRunner;
import com.notegraph.core.service.persistence.idle.NextTurnTaskRunner;
import com.notegraph.core.service.persistence.store.FileBytesStore;
import com.notegraph.core.service.persistence.store.FileTextStore;
import com.notegraph.core.service.persistence.store.StorageDestinations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires snapshot files, the idle runner and the persistence scheduler.
 */
@Slf4j
@Configuration
public class SnapshotStorageConfig {

    @Bean
    public StorageDestinations storageDestinations(PersistenceConfig persistenceConfig) {
        var directory = Path.of(persistenceConfig.getDirectory());
        var files = persistenceConfig.getFiles();
        log.info("Snapshots are stored in {}", directory.toAbsolutePath());

        return new StorageDestinations()
                .text(StorageDomain.GRAPH, new FileTextStore(directory.resolve(files.getGraph())))
                .text(StorageDomain.VECTOR_INDEX, new FileTextStore(directory.resolve(files.getVectorIndex())))
                .bytes(StorageDomain.RELATIONAL_METADATA,
                        new FileBytesStore(directory.resolve(files.getRelationalMetadata())));
    }

    @Bean
    public IdleTaskRunner idleTaskRunner(PersistenceConfig persistenceConfig,
                                         IngestionQueue ingestionQueue,
                                         @Qualifier("persistenceTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                                         @Qualifier("exportExecutor") ThreadPoolTaskExecutor exportExecutor,
                                         Clock clock) {
        var backend = persistenceConfig.getIdleBackend();
        log.info("Idle flushes run with the {} backend", backend);
        return switch (backend) {
            case INGESTION_IDLE -> new IngestionIdleTaskRunner(
                    ingestionQueue, taskScheduler, exportExecutor, clock, persistenceConfig.getIdleMaxWaitMs());
            case NEXT_TURN -> new NextTurnTaskRunner(exportExecutor);
        };
    }

    @Bean
    public PersistenceScheduler persistenceScheduler(StorageExporter storageExporter,
                                                     StorageDestinations storageDestinations,
                                                     @Qualifier("persistenceTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                                                     IdleTaskRunner idleTaskRunner,
                                                     @Qualifier("exportExecutor") ThreadPoolTaskExecutor exportExecutor,
                                                     MetricsConfig metricsConfig,
                                                     PersistenceConfig persistenceConfig,
                                                     Clock clock) {
        return new StoragePersistenceScheduler(
                storageExporter,
                storageDestinations,
                taskScheduler,
                idleTaskRunner,
                exportExecutor,
                metricsConfig,
                clock,
                persistenceConfig.getIdleTimeoutMs()
        );
    }
}
