package com.notegraph.core.service.graph.extract;

import java.util.List;

/**
 * Pulls relationship targets out of raw document text.
 *
 * Implementations are pure functions: no state, no I/O.
 */
public interface ContentExtractor {

    /**
     * Returns the wiki-link targets found in the text, aliases removed.
     */
    List<String> extractWikiLinks(String text);

    /**
     * Returns the distinct hashtags in first-occurrence order, without the leading {@code #}.
     */
    List<String> extractTags(String text);
}
