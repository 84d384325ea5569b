package com.notegraph.core.service.search.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecentOpenTrackerTest {

    private MutableClock clock;
    private RecentOpenTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tracker = new RecentOpenTracker(new ObjectMapper(), clock);
    }

    @Test
    void opensAreCountedWithLatestTimestamp() {
        tracker.recordOpen("a.md");
        clock.advance(Duration.ofMinutes(5));
        var signal = tracker.recordOpen("a.md");

        assertThat(signal.openCount()).isEqualTo(2);
        assertThat(signal.lastOpenTimestamp()).isEqualTo(clock.millis());
    }

    @Test
    void unknownPathsAreAbsent() {
        tracker.recordOpen("a.md");

        var signals = tracker.getSignalsForPaths(List.of("a.md", "b.md"));

        assertThat(signals).containsOnlyKeys("a.md");
    }

    @Test
    void forgetRemovesSignal() {
        tracker.recordOpen("a.md");
        tracker.forget("a.md");

        assertThat(tracker.size()).isZero();
    }

    @Test
    void snapshotRoundTrip() {
        tracker.recordOpen("a.md");
        tracker.recordOpen("a.md");
        tracker.recordOpen("b.md");

        var restored = new RecentOpenTracker(new ObjectMapper(), clock);
        restored.importSnapshot(tracker.exportSnapshot());

        assertThat(restored.getSignalsForPaths(List.of("a.md", "b.md")))
                .containsEntry("a.md", new RankingSignal(clock.millis(), 2))
                .containsEntry("b.md", new RankingSignal(clock.millis(), 1));
    }
}
