package com.notegraph.core.service.search;

/**
 * How candidates are retrieved.
 */
public enum RetrievalMode {
    FULLTEXT,
    VECTOR,
    /** One full-text and one vector retrieval, fused by reciprocal rank. */
    HYBRID
}
