package com.notegraph.core.service.graph;

import com.notegraph.core.service.graph.extract.ContentExtractor;
import com.notegraph.core.service.graph.model.EdgeKey;
import com.notegraph.core.service.graph.model.EdgeType;
import com.notegraph.core.service.graph.model.EdgeUpsert;
import com.notegraph.core.service.graph.model.GraphEdge;
import com.notegraph.core.service.graph.model.GraphNode;
import com.notegraph.core.service.graph.model.GraphPreview;
import com.notegraph.core.service.graph.model.GraphPreview.PreviewEdge;
import com.notegraph.core.service.graph.model.GraphPreview.PreviewNode;
import com.notegraph.core.service.graph.model.MarkdownDocument;
import com.notegraph.core.service.graph.model.NodeAttributes.CategoryAttributes;
import com.notegraph.core.service.graph.model.NodeAttributes.DocumentAttributes;
import com.notegraph.core.service.graph.model.NodeAttributes.LinkAttributes;
import com.notegraph.core.service.graph.model.NodeAttributes.TagAttributes;
import com.notegraph.core.service.graph.model.NodeType;
import com.notegraph.core.service.graph.model.NodeUpsert;
import com.notegraph.core.service.graph.model.PreviewRequest;
import com.notegraph.core.service.graph.storage.AttributeCodec;
import com.notegraph.core.service.graph.storage.EdgeRow;
import com.notegraph.core.service.graph.storage.GraphRepository;
import com.notegraph.core.service.graph.storage.NodeRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default RelationshipStore on top of a GraphRepository.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultRelationshipStore implements RelationshipStore {

    private static final String LINK_PREFIX = "link:";
    private static final String TAG_PREFIX = "tag:";
    private static final String CATEGORY_PREFIX = "category:";
    private static final String TAG_LABEL_PREFIX = "#";
    private static final List<String> DOCUMENT_TYPES = List.of(NodeType.DOCUMENT.storageName());

    private final GraphRepository repository;
    private final ContentExtractor contentExtractor;
    private final AttributeCodec attributeCodec;
    private final Clock clock;

    // ==================== Nodes ====================

    @Override
    public GraphNode upsertNode(NodeUpsert node) {
        var now = clock.instant();
        var createdAt = repository.findNodeById(node.id())
                .map(NodeRow::createdAt)
                .orElse(now);

        var row = new NodeRow(
                node.id(),
                node.type().storageName(),
                node.label(),
                attributeCodec.encode(node.attributes()),
                createdAt,
                now
        );
        repository.saveNode(row);
        return toNode(row);
    }

    @Override
    public Optional<GraphNode> getNode(String id) {
        return repository.findNodeById(id).map(this::toNode);
    }

    @Override
    public List<GraphNode> getNodesByType(NodeType type) {
        return repository.findNodesByType(type.storageName()).stream()
                .map(this::toNode)
                .toList();
    }

    @Override
    public void deleteNode(String id) {
        int outgoing = repository.deleteEdgesByFromNode(id);
        int incoming = repository.deleteEdgesByToNode(id);
        boolean deleted = repository.deleteNodeById(id);
        log.debug("Deleted node {} (found: {}), removed {} outgoing and {} incoming edges",
                id, deleted, outgoing, incoming);
    }

    // ==================== Edges ====================

    @Override
    public GraphEdge upsertEdge(EdgeUpsert edge) {
        var now = clock.instant();
        var edgeId = edge.key().edgeId();
        var existing = repository.findEdgeById(edgeId);

        double weight = existing
                .map(row -> row.weight() + edge.weight())
                .orElse(edge.weight());
        var createdAt = existing.map(EdgeRow::createdAt).orElse(now);

        var row = new EdgeRow(
                edgeId,
                edge.fromNodeId(),
                edge.toNodeId(),
                edge.type().storageName(),
                weight,
                attributeCodec.encode(edge.attributes()),
                createdAt,
                now
        );
        repository.saveEdge(row);
        return toEdge(row);
    }

    @Override
    public Optional<GraphEdge> getEdge(String fromNodeId, String toNodeId, EdgeType type) {
        var edgeId = new EdgeKey(fromNodeId, toNodeId, type).edgeId();
        return repository.findEdgeById(edgeId).map(this::toEdge);
    }

    @Override
    public boolean deleteEdge(String fromNodeId, String toNodeId, EdgeType type) {
        var edgeId = new EdgeKey(fromNodeId, toNodeId, type).edgeId();
        return repository.deleteEdgeById(edgeId);
    }

    @Override
    public List<GraphEdge> getOutgoingEdges(String nodeId) {
        return toEdges(repository.findEdgesByFromNode(nodeId));
    }

    @Override
    public List<GraphEdge> getIncomingEdges(String nodeId) {
        return toEdges(repository.findEdgesByToNode(nodeId));
    }

    @Override
    public List<GraphEdge> getOutgoingEdgesForNodes(Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return List.of();
        }
        return toEdges(repository.findEdgesByFromNodes(nodeIds));
    }

    // ==================== Traversal ====================

    @Override
    public List<String> getNeighborIds(String nodeId) {
        return repository.findEdgesByFromNode(nodeId).stream()
                .map(EdgeRow::toNodeId)
                .toList();
    }

    @Override
    public Set<String> getRelatedNodeIds(String startNodeId, int maxHops) {
        var visited = expandFrontier(List.of(startNodeId), maxHops);
        visited.remove(startNodeId);
        return visited;
    }

    @Override
    public Set<String> getNodeIdsWithinHops(Collection<String> seedIds, int maxHops) {
        return expandFrontier(seedIds, maxHops);
    }

    @Override
    public Set<String> getRelatedFilePaths(String currentFilePath, int maxHops) {
        var related = getRelatedNodeIds(currentFilePath, maxHops);
        if (related.isEmpty()) {
            return Set.of();
        }
        return repository.findIdsByIdsAndTypes(related, DOCUMENT_TYPES);
    }

    @Override
    public GraphPreview getPreview(PreviewRequest request) {
        var startId = request.startNodeId();
        if (repository.findNodeById(startId).isEmpty()) {
            return GraphPreview.empty();
        }

        var keep = expandFrontier(List.of(startId), Math.max(0, request.maxHops()));
        var nodes = repository.findNodesByIds(keep).stream()
                .limit(Math.max(0, request.maxNodes()))
                .map(this::toPreviewNode)
                .toList();

        var emitted = new LinkedHashSet<String>();
        nodes.forEach(node -> emitted.add(node.id()));

        var edges = emitted.isEmpty() ? List.<PreviewEdge>of() : repository.findEdgesByFromNodes(emitted).stream()
                .filter(edge -> emitted.contains(edge.toNodeId()))
                .map(edge -> new PreviewEdge(edge.fromNodeId(), edge.toNodeId(),
                        EdgeType.fromStorageName(edge.type()), edge.weight()))
                .toList();

        return new GraphPreview(nodes, edges);
    }

    @Override
    public List<String> findOrphanNodeIds(int limit) {
        return repository.findOrphanNodeIds(limit);
    }

    // ==================== Documents ====================

    @Override
    public GraphNode upsertDocument(String id, String path, String docType) {
        return upsertNode(NodeUpsert.builder()
                .id(id)
                .type(NodeType.DOCUMENT)
                .label(path)
                .attributes(new DocumentAttributes(path, docType))
                .build());
    }

    @Override
    public void upsertMarkdownDocument(MarkdownDocument document) {
        upsertDocument(document.id(), document.path(), document.docType());

        var links = contentExtractor.extractWikiLinks(document.content());
        for (var link : links) {
            var linkId = LINK_PREFIX + link;
            upsertNode(NodeUpsert.builder()
                    .id(linkId)
                    .type(NodeType.LINK)
                    .label(link)
                    .attributes(new LinkAttributes(link, false))
                    .build());
            upsertEdge(relation(document.id(), linkId, EdgeType.REFERENCES));
        }

        var tags = contentExtractor.extractTags(document.content());
        for (var tag : tags) {
            var tagId = TAG_PREFIX + tag;
            upsertNode(NodeUpsert.builder()
                    .id(tagId)
                    .type(NodeType.TAG)
                    .label(tag)
                    .attributes(new TagAttributes(tag))
                    .build());
            upsertEdge(relation(document.id(), tagId, EdgeType.TAGGED));
        }

        for (var category : document.categories()) {
            var categoryId = CATEGORY_PREFIX + category;
            upsertNode(NodeUpsert.builder()
                    .id(categoryId)
                    .type(NodeType.CATEGORY)
                    .label(category)
                    .attributes(new CategoryAttributes(category))
                    .build());
            upsertEdge(relation(document.id(), categoryId, EdgeType.CATEGORIZED));
        }

        log.debug("Indexed document {}: {} links, {} tags, {} categories",
                document.id(), links.size(), tags.size(), document.categories().size());
    }

    @Override
    public void removeDocument(String id) {
        deleteNode(id);
    }

    // ==================== Snapshots ====================

    @Override
    public GraphSnapshot snapshot() {
        return new GraphSnapshot(repository.findAllNodes(), repository.findAllEdges());
    }

    @Override
    public void restore(GraphSnapshot snapshot) {
        repository.clear();
        try {
            snapshot.nodes().forEach(repository::saveNode);
            snapshot.edges().forEach(repository::saveEdge);
        } catch (RuntimeException e) {
            repository.clear();
            throw e;
        }
    }

    @Override
    public GraphStats stats() {
        return new GraphStats(repository.countNodes(), repository.countEdges());
    }

    // ==================== Helper Methods ====================

    /**
     * Batched BFS: one neighbor lookup per hop for the whole frontier.
     * Returns the seeds followed by newly discovered nodes in discovery order.
     */
    private Set<String> expandFrontier(Collection<String> seedIds, int maxHops) {
        var visited = new LinkedHashSet<String>(seedIds);
        Set<String> frontier = new LinkedHashSet<>(seedIds);

        for (int hop = 0; hop < maxHops && !frontier.isEmpty(); hop++) {
            var next = new LinkedHashSet<String>();
            Map<String, Set<String>> neighborMap = repository.findNeighborIdsMap(frontier);
            for (var neighbors : neighborMap.values()) {
                for (var neighborId : neighbors) {
                    if (visited.add(neighborId)) {
                        next.add(neighborId);
                    }
                }
            }
            frontier = next;
        }
        return visited;
    }

    private static EdgeUpsert relation(String from, String to, EdgeType type) {
        return EdgeUpsert.builder()
                .fromNodeId(from)
                .toNodeId(to)
                .type(type)
                .weight(EdgeUpsert.DEFAULT_WEIGHT)
                .build();
    }

    private PreviewNode toPreviewNode(NodeRow row) {
        var type = NodeType.fromStorageName(row.type());
        var label = type == NodeType.TAG ? TAG_LABEL_PREFIX + row.label() : row.label();
        return new PreviewNode(row.id(), label, type);
    }

    private GraphNode toNode(NodeRow row) {
        var type = NodeType.fromStorageName(row.type());
        return new GraphNode(
                row.id(),
                type,
                row.label(),
                attributeCodec.decodeNode(type, row.attributes()),
                row.createdAt(),
                row.updatedAt()
        );
    }

    private GraphEdge toEdge(EdgeRow row) {
        var type = EdgeType.fromStorageName(row.type());
        return new GraphEdge(
                row.id(),
                row.fromNodeId(),
                row.toNodeId(),
                type,
                row.weight(),
                attributeCodec.decodeEdge(type, row.attributes()),
                row.createdAt(),
                row.updatedAt()
        );
    }

    private List<GraphEdge> toEdges(List<EdgeRow> rows) {
        var edges = new ArrayList<GraphEdge>(rows.size());
        rows.forEach(row -> edges.add(toEdge(row)));
        return edges;
    }
}
