package com.notegraph.core.service.search.signal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records document opens and serves them as ranking signals.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecentOpenTracker implements RankingSignalProvider {

    private static final TypeReference<Map<String, RankingSignal>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, RankingSignal> signals = new ConcurrentHashMap<>();

    /**
     * Counts one open of {@code path} at the current time.
     */
    public RankingSignal recordOpen(String path) {
        long now = clock.millis();
        return signals.merge(path, new RankingSignal(now, 1),
                (previous, ignored) -> new RankingSignal(now, previous.openCount() + 1));
    }

    public void forget(String path) {
        signals.remove(path);
    }

    @Override
    public Map<String, RankingSignal> getSignalsForPaths(Collection<String> paths) {
        var result = new HashMap<String, RankingSignal>();
        for (var path : paths) {
            var signal = signals.get(path);
            if (signal != null) {
                result.put(path, signal);
            }
        }
        return result;
    }

    public int size() {
        return signals.size();
    }

    // ==================== Snapshots ====================

    public byte[] exportSnapshot() {
        try {
            return objectMapper.writeValueAsBytes(new TreeMap<>(signals));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export ranking signals", e);
        }
    }

    public void importSnapshot(byte[] snapshot) {
        Map<String, RankingSignal> restored;
        try {
            restored = objectMapper.readValue(snapshot, SNAPSHOT_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to import ranking signals", e);
        }
        signals.clear();
        signals.putAll(restored);
        log.info("Restored ranking signals for {} paths", restored.size());
    }
}
