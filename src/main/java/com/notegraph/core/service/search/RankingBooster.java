package com.notegraph.core.service.search;

import com.notegraph.core.service.search.signal.RankingSignal;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Secondary reranking by usage and graph proximity.
 *
 * <pre>
 * finalScore = score
 *            + ln(1 + openCount) * 0.15
 *            + max(0, 0.3 - daysSinceLastOpen * 0.01)
 *            + (path in graph neighborhood ? 0.2 : 0)
 * </pre>
 */
public final class RankingBooster {

    static final double FREQUENCY_FACTOR = 0.15;
    static final double MAX_RECENCY_BOOST = 0.3;
    static final double RECENCY_DECAY_PER_DAY = 0.01;
    static final double GRAPH_BOOST = 0.2;

    private static final double DAY_MILLIS = Duration.ofDays(1).toMillis();

    private RankingBooster() {
    }

    /**
     * Returns the items with their final scores, sorted descending; ties keep input order.
     */
    public static List<SearchResultItem> apply(List<SearchResultItem> items,
                                               Map<String, RankingSignal> signals,
                                               Set<String> relatedPaths,
                                               long nowMillis) {
        var boosted = new ArrayList<SearchResultItem>(items.size());
        for (var item : items) {
            double finalScore = item.score()
                    + frequencyBoost(signals.get(item.path()))
                    + recencyBoost(signals.get(item.path()), nowMillis)
                    + (relatedPaths.contains(item.path()) ? GRAPH_BOOST : 0.0);
            boosted.add(item.withFinalScore(finalScore));
        }
        boosted.sort(Comparator.comparingDouble(SearchResultItem::finalScore).reversed());
        return boosted;
    }

    static double frequencyBoost(RankingSignal signal) {
        if (signal == null) {
            return 0.0;
        }
        return Math.log1p(signal.openCount()) * FREQUENCY_FACTOR;
    }

    static double recencyBoost(RankingSignal signal, long nowMillis) {
        if (signal == null || signal.lastOpenTimestamp() <= 0) {
            return 0.0;
        }
        double days = Math.max(0, (nowMillis - signal.lastOpenTimestamp()) / DAY_MILLIS);
        return Math.max(0, MAX_RECENCY_BOOST - days * RECENCY_DECAY_PER_DAY);
    }
}
