package com.notegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the NoteGraph core service.
 *
 * Contains feature flags, graph backend selection and Neo4j connection settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "notegraph")
public class NoteGraphConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Graph storage settings.
     */
    private GraphConfig graph = new GraphConfig();

    /**
     * Neo4j connection, used when {@code notegraph.graph.backend=neo4j}.
     */
    private Neo4jConfig neo4j = new Neo4jConfig();

    @Getter
    @Setter
    public static class Features {

        /**
         * Load persisted snapshots into memory at startup.
         */
        private boolean snapshotRestoreEnabled = true;

        /**
         * Flush dirty domains before the application context closes.
         */
        private boolean flushOnShutdown = true;
    }

    @Getter
    @Setter
    public static class GraphConfig {

        /**
         * Which GraphRepository backs the relationship store.
         */
        private GraphBackend backend = GraphBackend.MEMORY;
    }

    @Getter
    @Setter
    public static class Neo4jConfig {

        private String uri = "bolt://localhost:7687";

        /**
         * Leave empty to connect without authentication.
         */
        private String username = "neo4j";

        private String password = "password";

        /**
         * Target database; empty uses the server default.
         */
        private String database = "";
    }

    public enum GraphBackend {
        MEMORY,
        NEO4J
    }
}
