package com.notegraph.core.service.graph;

import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.EdgeUpsert;
import com.notegraph.core.service.graph.model.GraphEdge;
import com.notegraph.core.service.graph.model.GraphNode;
import com.notegraph.core.service.graph.model.GraphPreview;
import com.notegraph.core.service.graph.model.MarkdownDocument;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.graph.model.NodeUpsert;
import com.notegraph.core.service.graph.model.PreviewRequest;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent relationship graph over vault documents, tags, links and categories.
 *
 * All traversals expand a whole BFS frontier per storage call, so their cost grows with
 * the number of hops and not with the number of visited nodes. Storage errors propagate
 * to the caller unchanged.
 */
public interface RelationshipStore {

    int DEFAULT_MAX_HOPS = 2;

    // ==================== Nodes ====================

    /**
     * Inserts or updates a node by id. An existing node keeps its creation time.
     *
     * @param node the node to write
     * @return the stored node
     */
    GraphNode upsertNode(NodeUpsert node);

    Optional<GraphNode> getNode(String id);

    List<GraphNode> getNodesByType(NodeType type);

    /**
     * Deletes the node after deleting every edge it is the source of, then every edge it is the target of.
     */
    void deleteNode(String id);

    // ==================== Edges ====================

    /**
     * Inserts an edge or, when {@code (from, to, type)} already exists, adds the incoming
     * weight to the stored weight. The creation time of an existing edge is kept.
     *
     * @param edge the edge to write
     * @return the stored edge with its accumulated weight
     * @throws IllegalStateException if either endpoint node does not exist
     */
    GraphEdge upsertEdge(EdgeUpsert edge);

    Optional<GraphEdge> getEdge(String fromNodeId, String toNodeId, EdgeType type);

    boolean deleteEdge(String fromNodeId, String toNodeId, EdgeType type);

    List<GraphEdge> getOutgoingEdges(String nodeId);

    List<GraphEdge> getIncomingEdges(String nodeId);

    /**
     * Outgoing edges of all the given nodes, loaded in one storage call.
     */
    List<GraphEdge> getOutgoingEdgesForNodes(Collection<String> nodeIds);

    // ==================== Traversal ====================

    List<String> getNeighborIds(String nodeId);

    /**
     * Nodes reachable from {@code startNodeId} within {@code maxHops} outgoing steps, start node excluded.
     */
    Set<String> getRelatedNodeIds(String startNodeId, int maxHops);

    default Set<String> getRelatedNodeIds(String startNodeId) {
        return getRelatedNodeIds(startNodeId, DEFAULT_MAX_HOPS);
    }

    /**
     * Seeds plus every node reachable from them within {@code maxHops} outgoing steps.
     */
    Set<String> getNodeIdsWithinHops(Collection<String> seedIds, int maxHops);

    /**
     * Related nodes of the given document that are themselves documents.
     */
    Set<String> getRelatedFilePaths(String currentFilePath, int maxHops);

    default Set<String> getRelatedFilePaths(String currentFilePath) {
        return getRelatedFilePaths(currentFilePath, DEFAULT_MAX_HOPS);
    }

    /**
     * Bounded subgraph around a start node for display.
     */
    GraphPreview getPreview(PreviewRequest request);

    List<String> findOrphanNodeIds(int limit);

    // ==================== Documents ====================

    GraphNode upsertDocument(String id, String path, String docType);

    /**
     * Upserts the document node and a link, tag or category node plus an edge for every
     * wiki link, hashtag and category of the document. Link targets stay unresolved.
     */
    void upsertMarkdownDocument(MarkdownDocument document);

    /**
     * Removes the document node and its edges. Tag, link and category nodes are kept.
     */
    void removeDocument(String id);

    // ==================== Snapshots ====================

    GraphSnapshot snapshot();

    /**
     * Replaces the whole stored graph with the snapshot content.
     */
    void restore(GraphSnapshot snapshot);

    GraphStats stats();
}
