package com.notegraph.core.service.search.signal;

/**
 * Usage signal of one path.
 *
 * @param lastOpenTimestamp epoch millis of the last open, 0 when unknown
 * @param openCount         number of opens
 */
public record RankingSignal(long lastOpenTimestamp, long openCount) {
}
