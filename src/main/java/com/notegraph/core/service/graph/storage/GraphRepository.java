package com.notegraph.core.service.graph.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage contract for graph nodes and edges.
 *
 * Implementations must answer the batched lookups with a single round trip; traversal
 * cost is bounded by the number of hops, never by the number of visited nodes.
 */
public interface GraphRepository {

    // ==================== Nodes ====================

    Optional<NodeRow> findNodeById(String id);

    /**
     * Loads the given nodes, preserving the order of {@code ids} and skipping missing ones.
     */
    List<NodeRow> findNodesByIds(Collection<String> ids);

    List<NodeRow> findNodesByType(String type);

    /**
     * Returns the subset of {@code ids} whose node type is one of {@code types}.
     */
    Set<String> findIdsByIdsAndTypes(Collection<String> ids, Collection<String> types);

    void saveNode(NodeRow row);

    boolean deleteNodeById(String id);

    long countNodes();

    // ==================== Edges ====================

    Optional<EdgeRow> findEdgeById(String id);

    /**
     * Writes an edge row. Both endpoint nodes must already be stored.
     *
     * @throws IllegalStateException if either endpoint is missing
     */
    void saveEdge(EdgeRow row);

    boolean deleteEdgeById(String id);

    List<EdgeRow> findEdgesByFromNode(String fromNodeId);

    List<EdgeRow> findEdgesByToNode(String toNodeId);

    /**
     * Outgoing edges of every node in {@code fromNodeIds}, fetched in one call.
     */
    List<EdgeRow> findEdgesByFromNodes(Collection<String> fromNodeIds);

    /**
     * Outgoing neighbor ids for many nodes at once. Nodes without outgoing edges may be absent from the map.
     */
    Map<String, Set<String>> findNeighborIdsMap(Collection<String> nodeIds);

    int deleteEdgesByFromNode(String fromNodeId);

    int deleteEdgesByToNode(String toNodeId);

    long countEdges();

    // ==================== Maintenance ====================

    /**
     * Ids of nodes with no incoming and no outgoing edge.
     */
    List<String> findOrphanNodeIds(int limit);

    List<NodeRow> findAllNodes();

    List<EdgeRow> findAllEdges();

    /**
     * Removes every node and edge.
     */
    void clear();
}
