package com.notegraph.core.service.analysis;

import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.GraphEdge;
import com.notegraph.core.service.graph.model.GraphNode;
import com.notegraph.core.service.graph.model.GraphPreview;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.graph.model.PreviewRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Disposable analysis view over the relationship store.
 *
 * Lifecycle: create, {@link #buildGraph}, run algorithms on {@link #getGraph()}, then
 * {@link #close()}. An instance belongs to a single operation and is never shared;
 * create a new one through {@link GraphAnalyzerFactory} for each analysis.
 */
@Slf4j
public class InMemoryGraphAnalyzer implements AutoCloseable {

    static final int NEIGHBORHOOD_HOPS = 2;

    private final RelationshipStore store;
    private final GraphMetadataAccessor metadata;

    private TopologyGraph graph;

    public InMemoryGraphAnalyzer(RelationshipStore store) {
        this.store = store;
        this.metadata = new GraphMetadataAccessor(store);
    }

    // ==================== Topology ====================

    /**
     * Loads the whole graph.
     */
    public TopologyGraph buildGraph() {
        return buildGraph(null);
    }

    /**
     * Loads the 2-hop neighborhood of the given centers, or every node when no center is given.
     * Replaces any previously built topology.
     */
    public TopologyGraph buildGraph(Collection<String> centerNodeIds) {
        var nodeIds = centerNodeIds == null || centerNodeIds.isEmpty()
                ? collectAllNodeIds()
                : store.getNodeIdsWithinHops(centerNodeIds, NEIGHBORHOOD_HOPS);

        var topology = new TopologyGraph();
        nodeIds.forEach(topology::addNode);

        for (GraphEdge edge : store.getOutgoingEdgesForNodes(nodeIds)) {
            if (nodeIds.contains(edge.toNodeId())) {
                topology.addEdge(edge.fromNodeId(), edge.toNodeId(), edge.weight());
            }
        }

        this.graph = topology;
        log.debug("Built analysis topology: {} nodes, {} edges", topology.nodeCount(), topology.edgeCount());
        return topology;
    }

    /**
     * @throws GraphNotBuiltException before {@link #buildGraph} or after {@link #release()}
     */
    public TopologyGraph getGraph() {
        if (graph == null) {
            throw new GraphNotBuiltException();
        }
        return graph;
    }

    public boolean hasGraph() {
        return graph != null;
    }

    /**
     * Drops the built topology. Safe to call more than once.
     */
    public void release() {
        graph = null;
    }

    @Override
    public void close() {
        release();
    }

    // ==================== Metadata ====================

    public GraphMetadataAccessor metadata() {
        return metadata;
    }

    public Optional<GraphNode> getNodeMetadata(String nodeId) {
        return metadata.getNodeMetadata(nodeId);
    }

    public Optional<GraphEdge> getEdgeMetadata(String fromNodeId, String toNodeId, EdgeType type) {
        return metadata.getEdgeMetadata(fromNodeId, toNodeId, type);
    }

    // ==================== Store Delegations ====================

    public GraphPreview buildPreview(PreviewRequest request) {
        return store.getPreview(request);
    }

    public Set<String> getRelatedDocumentIds(String documentId, int maxHops) {
        return store.getRelatedFilePaths(documentId, maxHops);
    }

    // ==================== Helper Methods ====================

    private Set<String> collectAllNodeIds() {
        var ids = new LinkedHashSet<String>();
        for (var type : NodeType.values()) {
            store.getNodesByType(type).forEach(node -> ids.add(node.id()));
        }
        return ids;
    }
}
