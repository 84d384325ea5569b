package com.notegraph.core.service.search;

/**
 * One ranked search result.
 *
 * {@code score} is the retrieval (or fused) score; {@code finalScore} adds the ranking boosts.
 */
public record SearchResultItem(
        String id,
        String type,
        String title,
        String path,
        long lastModified,
        SearchSnippet snippet,
        double score,
        double finalScore
) {

    public SearchResultItem withFinalScore(double newFinalScore) {
        return new SearchResultItem(id, type, title, path, lastModified, snippet, score, newFinalScore);
    }
}
