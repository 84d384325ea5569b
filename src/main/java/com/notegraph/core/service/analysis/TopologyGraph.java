package com.notegraph.core.service.analysis;

import org.jgrapht.Graph;
import org.jgrapht.graph.AsUndirectedGraph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.DirectedWeightedPseudograph;

import java.util.Set;

/**
 * Minimal topology of the relationship graph: node ids and weighted directed edges.
 *
 * Labels, attributes and edge types are deliberately absent; look them up through
 * {@link GraphMetadataAccessor}. Parallel edges and self loops are allowed.
 */
public final class TopologyGraph {

    private final Graph<String, DefaultWeightedEdge> graph =
            new DirectedWeightedPseudograph<>(DefaultWeightedEdge.class);

    TopologyGraph() {
    }

    // ==================== Building ====================

    void addNode(String nodeId) {
        graph.addVertex(nodeId);
    }

    void addEdge(String fromNodeId, String toNodeId, double weight) {
        if (!graph.containsVertex(fromNodeId) || !graph.containsVertex(toNodeId)) {
            return;
        }
        var edge = graph.addEdge(fromNodeId, toNodeId);
        graph.setEdgeWeight(edge, weight);
    }

    // ==================== Queries ====================

    public Set<String> nodeIds() {
        return graph.vertexSet();
    }

    public boolean containsNode(String nodeId) {
        return graph.containsVertex(nodeId);
    }

    public int nodeCount() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public int outDegree(String nodeId) {
        return graph.outDegreeOf(nodeId);
    }

    public int inDegree(String nodeId) {
        return graph.inDegreeOf(nodeId);
    }

    /**
     * Sum of the weights of all edges from {@code fromNodeId} to {@code toNodeId}.
     */
    public double weightBetween(String fromNodeId, String toNodeId) {
        if (!containsNode(fromNodeId) || !containsNode(toNodeId)) {
            return 0.0;
        }
        return graph.getAllEdges(fromNodeId, toNodeId).stream()
                .mapToDouble(graph::getEdgeWeight)
                .sum();
    }

    /**
     * Read-only directed view for JGraphT algorithms.
     */
    public Graph<String, DefaultWeightedEdge> directed() {
        return new AsUnmodifiableGraph<>(graph);
    }

    /**
     * Read-only undirected view, for algorithms that ignore edge direction.
     */
    public Graph<String, DefaultWeightedEdge> undirected() {
        return new AsUnmodifiableGraph<>(new AsUndirectedGraph<>(graph));
    }
}
