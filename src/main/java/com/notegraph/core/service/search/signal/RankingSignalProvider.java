package com.notegraph.core.service.search.signal;

import java.util.Collection;
import java.util.Map;

/**
 * Read-only source of usage signals for reranking.
 */
public interface RankingSignalProvider {

    /**
     * Signals of the given paths; paths without a signal are absent from the map.
     */
    Map<String, RankingSignal> getSignalsForPaths(Collection<String> paths);
}
