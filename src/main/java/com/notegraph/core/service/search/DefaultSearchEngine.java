package com.notegraph.core.service.search;

import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.config.SearchConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.search.index.RetrievalHit;
import com.notegraph.core.service.search.index.RetrievalIndex;
import com.notegraph.core.service.search.index.RetrievalRequest;
import com.notegraph.core.service.search.signal.RankingSignalProvider;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default SearchEngine over a RetrievalIndex, usage signals and the relationship graph.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultSearchEngine implements SearchEngine {

    static final List<String> TEXT_FIELDS = List.of("title", "content");
    static final Map<String, Double> TEXT_BOOSTS = Map.of("title", 2.0, "content", 1.0);

    private static final String DEFAULT_DOC_TYPE = "markdown";

    private final RetrievalIndex retrievalIndex;
    private final RankingSignalProvider signalProvider;
    private final RelationshipStore relationshipStore;
    private final SearchConfig searchConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Override
    public SearchResponse search(SearchQuery query) {
        long startMillis = clock.millis();
        var sample = Timer.start(metricsConfig.getRegistry());

        try {
            var mode = query.effectiveRetrievalMode();
            if (mode != RetrievalMode.FULLTEXT) {
                validateEmbedding(mode, query.embedding());
            }

            int topK = resolveTopK(query);
            var candidates = retrieve(mode, query, topK);
            var items = candidates.stream()
                    .map(hit -> toItem(hit, query.text()))
                    .toList();

            var ranked = rerank(items, query.scope());
            metricsConfig.getSearchesExecuted().increment();

            long duration = clock.millis() - startMillis;
            log.debug("Search '{}' ({}, {}) returned {} items in {}ms",
                    query.text(), mode, query.scopeMode(), ranked.size(), duration);
            return new SearchResponse(query, ranked, duration);
        } finally {
            sample.stop(metricsConfig.getSearchTimer());
        }
    }

    // ==================== Retrieval ====================

    private List<RetrievalHit> retrieve(RetrievalMode mode, SearchQuery query, int topK) {
        return switch (mode) {
            case FULLTEXT -> inScope(retrievalIndex.search(textRequest(query, topK)), query);
            case VECTOR -> inScope(retrievalIndex.search(vectorRequest(query, topK)), query);
            case HYBRID -> {
                var textHits = inScope(retrievalIndex.search(textRequest(query, topK)), query);
                var vectorHits = inScope(retrievalIndex.search(vectorRequest(query, topK)), query);
                yield ReciprocalRankFusion.fuse(textHits, vectorHits, topK);
            }
        };
    }

    private RetrievalRequest textRequest(SearchQuery query, int topK) {
        return RetrievalRequest.builder()
                .mode(RetrievalMode.FULLTEXT)
                .term(query.text())
                .fields(TEXT_FIELDS)
                .boosts(TEXT_BOOSTS)
                .limit(topK)
                .build();
    }

    private RetrievalRequest vectorRequest(SearchQuery query, int topK) {
        return RetrievalRequest.builder()
                .mode(RetrievalMode.VECTOR)
                .embedding(query.embedding())
                .limit(topK)
                .build();
    }

    private List<RetrievalHit> inScope(List<RetrievalHit> hits, SearchQuery query) {
        return hits.stream()
                .filter(hit -> ScopeFilter.keep(query.scopeMode(), query.scope(), hit.path()))
                .toList();
    }

    // ==================== Ranking ====================

    private List<SearchResultItem> rerank(List<SearchResultItem> items, SearchScope scope) {
        if (items.isEmpty()) {
            return items;
        }
        var paths = items.stream().map(SearchResultItem::path).toList();
        var signals = signalProvider.getSignalsForPaths(paths);
        Set<String> related = scope.currentFilePath() == null
                ? Set.of()
                : relationshipStore.getRelatedFilePaths(scope.currentFilePath(), searchConfig.getGraphBoostHops());
        return RankingBooster.apply(items, signals, related, clock.millis());
    }

    // ==================== Helper Methods ====================

    private void validateEmbedding(RetrievalMode mode, float[] embedding) {
        if (embedding == null) {
            throw EmbeddingValidationException.missing(mode);
        }
        int expected = searchConfig.getEmbeddingDimension();
        if (embedding.length != expected) {
            throw EmbeddingValidationException.dimensionMismatch(expected, embedding.length);
        }
    }

    private int resolveTopK(SearchQuery query) {
        var topK = query.topK();
        return topK != null && topK > 0 ? topK : searchConfig.getDefaultTopK();
    }

    private static SearchResultItem toItem(RetrievalHit hit, String queryText) {
        return new SearchResultItem(
                hit.documentId(),
                hit.docType() != null ? hit.docType() : DEFAULT_DOC_TYPE,
                hit.title() != null ? hit.title() : hit.path(),
                hit.path(),
                hit.modifiedTime(),
                SnippetBuilder.build(hit.content(), queryText),
                hit.score(),
                hit.score()
        );
    }
}
