package com.notegraph.core.service.search;

import com.notegraph.core.service.search.index.RetrievalHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Merges a full-text and a vector hit list by reciprocal rank.
 *
 * Each appearance contributes {@code weight / (k + rank)} with a 1-based rank; contributions
 * accumulate per path. Only ranks matter, so the fused order does not depend on the scales
 * of the two retrieval scores.
 */
public final class ReciprocalRankFusion {

    public static final int K = 60;
    public static final double TEXT_WEIGHT = 0.6;
    public static final double VECTOR_WEIGHT = 0.4;

    private ReciprocalRankFusion() {
    }

    /**
     * Fuses both lists and keeps the best {@code limit} entries. Each returned hit carries
     * its fused score; a path found in both lists keeps the full-text hit's fields.
     * Equal scores keep first-appearance order.
     */
    public static List<RetrievalHit> fuse(List<RetrievalHit> textHits, List<RetrievalHit> vectorHits, int limit) {
        var fused = new LinkedHashMap<String, Entry>();
        accumulate(fused, textHits, TEXT_WEIGHT, true);
        accumulate(fused, vectorHits, VECTOR_WEIGHT, false);

        var entries = new ArrayList<>(fused.values());
        entries.sort(Comparator.comparingDouble(Entry::score).reversed());

        return entries.stream()
                .limit(Math.max(0, limit))
                .map(entry -> entry.hit().withScore(entry.score()))
                .toList();
    }

    private static void accumulate(LinkedHashMap<String, Entry> fused, List<RetrievalHit> hits,
                                   double weight, boolean replaceHit) {
        for (int rank = 1; rank <= hits.size(); rank++) {
            var hit = hits.get(rank - 1);
            double contribution = weight / (K + rank);
            var existing = fused.get(hit.path());
            if (existing == null) {
                fused.put(hit.path(), new Entry(hit, contribution));
            } else {
                fused.put(hit.path(), new Entry(replaceHit ? hit : existing.hit(), existing.score() + contribution));
            }
        }
    }

    private record Entry(RetrievalHit hit, double score) {
    }
}
