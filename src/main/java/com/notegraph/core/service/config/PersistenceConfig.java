package com.notegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the debounced snapshot writer.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "notegraph.persistence")
public class PersistenceConfig {

    /**
     * Directory holding the snapshot files.
     */
    private String directory = "data";

    /**
     * Debounce window of {@code flushWhenIdle} in milliseconds.
     */
    private long idleTimeoutMs = 5000;

    /**
     * Longest time an idle runner waits for the host to become idle before running anyway.
     */
    private long idleMaxWaitMs = 1200;

    /**
     * How a debounced flush is handed off once the timer fires.
     */
    private IdleBackend idleBackend = IdleBackend.INGESTION_IDLE;

    /**
     * Snapshot file names, relative to {@link #directory}.
     */
    private Files files = new Files();

    @Getter
    @Setter
    public static class Files {

        private String graph = "graph.json";

        private String vectorIndex = "search-index.json";

        private String relationalMetadata = "ranking-signals.bin";
    }

    public enum IdleBackend {
        /** Wait until the ingestion queue is drained. */
        INGESTION_IDLE,
        /** Run on the next turn of the export executor. */
        NEXT_TURN
    }
}
