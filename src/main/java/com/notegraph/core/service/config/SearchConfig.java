package com.notegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Search ranking settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "notegraph.search")
public class SearchConfig {

    /**
     * Expected length of query and document embeddings.
     */
    private int embeddingDimension = 384;

    /**
     * Result limit when a query does not set one.
     */
    private int defaultTopK = 50;

    /**
     * Hops around the current file that earn the graph boost.
     */
    private int graphBoostHops = 2;
}
