package com.notegraph.core.service.graph;

public record GraphStats(long nodeCount, long edgeCount) {
}
