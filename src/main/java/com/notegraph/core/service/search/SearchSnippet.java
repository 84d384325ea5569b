package com.notegraph.core.service.search;

import java.util.List;

/**
 * Excerpt of a document with highlighted ranges, offsets relative to {@code text}.
 */
public record SearchSnippet(String text, List<Highlight> highlights) {

    public SearchSnippet {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }

    public record Highlight(int start, int end) {
    }
}
