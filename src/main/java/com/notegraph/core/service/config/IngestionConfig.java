package com.notegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Document ingestion settings: the change queue and its single worker.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "notegraph.ingest")
public class IngestionConfig {

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig worker = new WorkerConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        private int capacity = 10000;

        /**
         * Utilization percentage at which the queue health turns DOWN.
         */
        private int backpressureThreshold = 80;

        /**
         * How long a producer waits for free capacity before the change is rejected.
         */
        private long offerTimeoutMs = 5000;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        private long pollTimeoutMs = 100;

        /**
         * Grace period for the item being processed when the context closes.
         */
        private long shutdownTimeoutSeconds = 30;
    }
}
