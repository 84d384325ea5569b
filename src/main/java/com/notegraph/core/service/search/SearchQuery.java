package com.notegraph.core.service.search;

import lombok.Builder;

/**
 * A search request.
 *
 * @param text         query text; may be empty
 * @param embedding    query embedding, required for VECTOR and HYBRID retrieval
 * @param retrievalMode explicit retrieval mode; derived from the embedding when null
 * @param scopeMode    scope restriction, VAULT when null
 * @param scope        scope parameters
 * @param topK         result limit, configured default when null
 */
@Builder
public record SearchQuery(
        String text,
        float[] embedding,
        RetrievalMode retrievalMode,
        ScopeMode scopeMode,
        SearchScope scope,
        Integer topK
) {

    public SearchQuery {
        if (text == null) {
            text = "";
        }
        if (scopeMode == null) {
            scopeMode = ScopeMode.VAULT;
        }
        if (scope == null) {
            scope = SearchScope.none();
        }
    }

    /**
     * The retrieval mode to run: the explicit one, else HYBRID with an embedding and FULLTEXT without.
     */
    public RetrievalMode effectiveRetrievalMode() {
        if (retrievalMode != null) {
            return retrievalMode;
        }
        return embedding != null ? RetrievalMode.HYBRID : RetrievalMode.FULLTEXT;
    }
}
