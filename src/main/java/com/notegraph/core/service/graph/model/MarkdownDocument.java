package com.notegraph.core.service.graph.model;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * A markdown document to be projected into the graph.
 */
@Builder
public record MarkdownDocument(String id, String path, String content, String docType,
                               List<String> categories) {

    public MarkdownDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        if (content == null) {
            content = "";
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
