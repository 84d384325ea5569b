package com.notegraph.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the NoteGraph core service.
 *
 * Provides custom metrics for ingestion, search, graph analysis and persistence.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter documentsIngested;
    private final Counter documentsRemoved;
    private final Counter searchesExecuted;
    private final Counter flushesCompleted;
    private final Counter flushesFailed;

    // Timers
    private final Timer ingestionTimer;
    private final Timer searchTimer;
    private final Timer analysisBuildTimer;
    private final Timer flushTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.documentsIngested = Counter.builder("notegraph.ingest.documents.count")
                .description("Number of documents indexed into the graph and search index")
                .register(registry);

        this.documentsRemoved = Counter.builder("notegraph.ingest.removals.count")
                .description("Number of documents removed")
                .register(registry);

        this.searchesExecuted = Counter.builder("notegraph.search.count")
                .description("Number of search queries executed")
                .register(registry);

        this.flushesCompleted = Counter.builder("notegraph.persistence.flush.count")
                .description("Number of flush cycles written to disk")
                .register(registry);

        this.flushesFailed = Counter.builder("notegraph.persistence.flush.failures")
                .description("Number of flush cycles that failed")
                .register(registry);

        this.ingestionTimer = Timer.builder("notegraph.ingest.duration")
                .description("Time taken for ingestion processing")
                .register(registry);

        this.searchTimer = Timer.builder("notegraph.search.duration")
                .description("Time taken to answer a search query")
                .register(registry);

        this.analysisBuildTimer = Timer.builder("notegraph.analysis.build.duration")
                .description("Time taken to build an analysis topology")
                .register(registry);

        this.flushTimer = Timer.builder("notegraph.persistence.flush.duration")
                .description("Time taken for one export and write cycle")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
