package com.notegraph.core.service.analysis;

/**
 * A highly connected node with the measures it was ranked by.
 */
public record KeyNode(String id, String label, int outDegree, int inDegree, double pageRank, double score) {
}
