package com.notegraph.core.service.search;

import com.notegraph.core.service.search.SearchSnippet.Highlight;

import java.util.List;
import java.util.Locale;

/**
 * Cuts a display window around the first case-insensitive match of the query.
 */
public final class SnippetBuilder {

    static final int WINDOW_BEFORE = 80;
    static final int WINDOW_AFTER = 140;
    static final int NO_MATCH_LENGTH = 220;
    static final int NO_QUERY_LENGTH = 200;

    private SnippetBuilder() {
    }

    /**
     * @return the snippet, or null for empty content
     */
    public static SearchSnippet build(String content, String query) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        var term = query == null ? "" : query.trim();
        if (term.isEmpty()) {
            return new SearchSnippet(leading(content, NO_QUERY_LENGTH), List.of());
        }

        int index = content.toLowerCase(Locale.ROOT).indexOf(term.toLowerCase(Locale.ROOT));
        if (index < 0) {
            return new SearchSnippet(leading(content, NO_MATCH_LENGTH), List.of());
        }

        int start = Math.max(0, index - WINDOW_BEFORE);
        int end = Math.min(content.length(), index + term.length() + WINDOW_AFTER);
        int highlightStart = index - start;
        return new SearchSnippet(
                content.substring(start, end),
                List.of(new Highlight(highlightStart, highlightStart + term.length())));
    }

    private static String leading(String content, int length) {
        return content.substring(0, Math.min(content.length(), length));
    }
}
