package com.notegraph.core.service.search.index;

import java.util.List;

/**
 * Lexical and vector retrieval primitive.
 */
public interface RetrievalIndex {

    /**
     * Runs one retrieval. Hits are ordered by descending relevance.
     *
     * @throws IllegalArgumentException for a mode the index cannot run in a single call
     */
    List<RetrievalHit> search(RetrievalRequest request);

    void upsert(IndexedDocument document);

    boolean remove(String documentId);

    int size();

    /**
     * Serializes the whole index.
     */
    String exportSnapshot();

    /**
     * Replaces the index content with a snapshot produced by {@link #exportSnapshot()}.
     */
    void importSnapshot(String snapshot);
}
