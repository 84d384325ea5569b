package com.notegraph.core.service.search.index;

import lombok.Builder;

import java.util.Objects;

/**
 * A document as stored in the retrieval index.
 */
@Builder
public record IndexedDocument(
        String id,
        String path,
        String title,
        String content,
        String docType,
        long modifiedTime,
        float[] embedding
) {

    public IndexedDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        if (title == null) {
            title = path;
        }
        if (content == null) {
            content = "";
        }
    }
}
