package com.notegraph.core.service.persistence;

/**
 * Independently persisted parts of the service state.
 */
public enum StorageDomain {
    /** The relationship graph. */
    GRAPH,
    /** The retrieval index, including embeddings. */
    VECTOR_INDEX,
    /** Ranking signals and other small relational metadata. */
    RELATIONAL_METADATA
}
