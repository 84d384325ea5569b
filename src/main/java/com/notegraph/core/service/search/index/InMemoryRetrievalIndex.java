package com.notegraph.core.service.search.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory RetrievalIndex.
 *
 * Full-text scoring counts case-insensitive keyword occurrences per field and multiplies
 * them by the field boost. Vector scoring is cosine similarity against the stored embedding;
 * documents without an embedding of the query's length are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryRetrievalIndex implements RetrievalIndex {

    private static final TypeReference<List<IndexedDocument>> SNAPSHOT_TYPE = new TypeReference<>() {};
    private static final Comparator<RetrievalHit> BY_RELEVANCE =
            Comparator.comparingDouble(RetrievalHit::score).reversed()
                    .thenComparing(RetrievalHit::path);

    private final ObjectMapper objectMapper;
    private final MetricsConfig metricsConfig;

    private final Map<String, IndexedDocument> documents = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "notegraph.search.index.documents",
                "Number of documents in the retrieval index",
                this::size
        );
    }

    // ==================== Retrieval ====================

    @Override
    public List<RetrievalHit> search(RetrievalRequest request) {
        var mode = Objects.requireNonNull(request.mode(), "mode");
        return switch (mode) {
            case FULLTEXT -> searchText(request);
            case VECTOR -> searchVector(request);
            case HYBRID -> throw new IllegalArgumentException(
                    "Hybrid retrieval is not a single index call; issue FULLTEXT and VECTOR separately");
        };
    }

    private List<RetrievalHit> searchText(RetrievalRequest request) {
        var keywords = keywords(request.term());
        if (keywords.isEmpty()) {
            return List.of();
        }
        return documents.values().stream()
                .map(doc -> toHit(doc, textScore(doc, keywords, request)))
                .filter(hit -> hit.score() > 0)
                .sorted(BY_RELEVANCE)
                .limit(request.limit())
                .toList();
    }

    private List<RetrievalHit> searchVector(RetrievalRequest request) {
        var query = request.embedding();
        if (query == null || query.length == 0) {
            return List.of();
        }
        return documents.values().stream()
                .filter(doc -> doc.embedding() != null && doc.embedding().length == query.length)
                .map(doc -> toHit(doc, cosine(query, doc.embedding())))
                .sorted(BY_RELEVANCE)
                .limit(request.limit())
                .toList();
    }

    // ==================== Mutation ====================

    @Override
    public void upsert(IndexedDocument document) {
        documents.put(document.id(), document);
    }

    @Override
    public boolean remove(String documentId) {
        return documents.remove(documentId) != null;
    }

    @Override
    public int size() {
        return documents.size();
    }

    // ==================== Snapshots ====================

    @Override
    public String exportSnapshot() {
        var ordered = documents.values().stream()
                .sorted(Comparator.comparing(IndexedDocument::id))
                .toList();
        try {
            return objectMapper.writeValueAsString(ordered);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export search index", e);
        }
    }

    @Override
    public void importSnapshot(String snapshot) {
        List<IndexedDocument> restored;
        try {
            restored = objectMapper.readValue(snapshot, SNAPSHOT_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to import search index", e);
        }
        documents.clear();
        restored.forEach(this::upsert);
        log.info("Restored search index snapshot: {} documents", restored.size());
    }

    // ==================== Scoring ====================

    private static double textScore(IndexedDocument doc, List<String> keywords, RetrievalRequest request) {
        double score = 0;
        for (var field : request.fields()) {
            var value = fieldValue(doc, field);
            if (value == null || value.isEmpty()) {
                continue;
            }
            var lower = value.toLowerCase(Locale.ROOT);
            double boost = request.boosts().getOrDefault(field, 1.0);
            for (var keyword : keywords) {
                score += boost * occurrences(lower, keyword);
            }
        }
        return score;
    }

    private static String fieldValue(IndexedDocument doc, String field) {
        return switch (field) {
            case "title" -> doc.title();
            case "content" -> doc.content();
            case "path" -> doc.path();
            default -> null;
        };
    }

    private static int occurrences(String text, String keyword) {
        int count = 0;
        int from = text.indexOf(keyword);
        while (from >= 0) {
            count++;
            from = text.indexOf(keyword, from + keyword.length());
        }
        return count;
    }

    private static List<String> keywords(String term) {
        if (term == null || term.isBlank()) {
            return List.of();
        }
        return Arrays.stream(term.trim().split("\\s+"))
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static RetrievalHit toHit(IndexedDocument doc, double score) {
        return new RetrievalHit(doc.id(), doc.path(), doc.title(), doc.content(),
                doc.docType(), doc.modifiedTime(), score);
    }
}
