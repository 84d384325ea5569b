package com.notegraph.core.service.health;

import com.notegraph.core.service.config.IngestionConfig;
import com.notegraph.core.service.ingest.IngestionQueue;
import com.notegraph.core.service.ingest.IngestionWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * DOWN while the ingestion worker is stopped or the change queue is past its backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class IngestionQueueHealthIndicator implements HealthIndicator {

    private final IngestionQueue queue;
    private final IngestionWorker worker;
    private final IngestionConfig config;

    @Override
    public Health health() {
        int utilization = queue.utilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();
        boolean workerRunning = worker.isRunning();

        Health.Builder builder;
        if (!workerRunning) {
            builder = Health.down().withDetail("reason", "ingestion worker stopped");
        } else if (utilization >= threshold) {
            builder = Health.down().withDetail("reason", "backpressure");
        } else {
            builder = Health.up();
        }

        return builder
                .withDetail("pending", queue.pending())
                .withDetail("inProgress", queue.inProgress())
                .withDetail("capacity", queue.capacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .build();
    }
}
