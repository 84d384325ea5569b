package com.notegraph.core.service.search;

/**
 * Ranked search over the vault.
 */
public interface SearchEngine {

    /**
     * Retrieves candidates, applies the scope filter, fuses full-text and vector lists when both
     * run, and reranks by usage signals and graph proximity.
     *
     * @throws EmbeddingValidationException when a vector retrieval lacks a valid embedding;
     *                                      no index call is made in that case
     */
    SearchResponse search(SearchQuery query);
}
