package com.notegraph.core.service.graph.storage;

import com.notegraph.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-memory implementation of GraphRepository.
 *
 * Nodes and edges live in concurrent maps; two adjacency indexes (by source and by target)
 * keep per-node edge lookups independent of the graph size. Edge ids in the indexes keep
 * insertion order so traversals are deterministic.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemoryGraphRepository implements GraphRepository {

    private final MetricsConfig metricsConfig;

    private final Map<String, NodeRow> nodes = new ConcurrentHashMap<>();
    private final Map<String, EdgeRow> edges = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> outgoing = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> incoming = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "notegraph.graph.nodes.count",
                "Number of nodes in the relationship graph",
                this::countNodes
        );
        metricsConfig.registerStoreGauge(
                "notegraph.graph.edges.count",
                "Number of edges in the relationship graph",
                this::countEdges
        );
        log.info("InMemoryGraphRepository initialized");
    }

    // ==================== Nodes ====================

    @Override
    public Optional<NodeRow> findNodeById(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public List<NodeRow> findNodesByIds(Collection<String> ids) {
        var result = new ArrayList<NodeRow>(ids.size());
        for (var id : new LinkedHashSet<>(ids)) {
            var row = nodes.get(id);
            if (row != null) {
                result.add(row);
            }
        }
        return result;
    }

    @Override
    public List<NodeRow> findNodesByType(String type) {
        return nodes.values().stream()
                .filter(row -> row.type().equals(type))
                .toList();
    }

    @Override
    public Set<String> findIdsByIdsAndTypes(Collection<String> ids, Collection<String> types) {
        var result = new LinkedHashSet<String>();
        for (var id : ids) {
            var row = nodes.get(id);
            if (row != null && types.contains(row.type())) {
                result.add(id);
            }
        }
        return result;
    }

    @Override
    public void saveNode(NodeRow row) {
        nodes.put(row.id(), row);
    }

    @Override
    public boolean deleteNodeById(String id) {
        return nodes.remove(id) != null;
    }

    @Override
    public long countNodes() {
        return nodes.size();
    }

    // ==================== Edges ====================

    @Override
    public Optional<EdgeRow> findEdgeById(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    @Override
    public void saveEdge(EdgeRow row) {
        if (!nodes.containsKey(row.fromNodeId()) || !nodes.containsKey(row.toNodeId())) {
            throw new IllegalStateException("Cannot save edge %s: endpoint %s or %s does not exist"
                    .formatted(row.id(), row.fromNodeId(), row.toNodeId()));
        }
        edges.put(row.id(), row);
        index(outgoing, row.fromNodeId(), row.id());
        index(incoming, row.toNodeId(), row.id());
    }

    @Override
    public boolean deleteEdgeById(String id) {
        var removed = edges.remove(id);
        if (removed == null) {
            return false;
        }
        unindex(outgoing, removed.fromNodeId(), id);
        unindex(incoming, removed.toNodeId(), id);
        return true;
    }

    @Override
    public List<EdgeRow> findEdgesByFromNode(String fromNodeId) {
        return resolveEdges(outgoing.get(fromNodeId));
    }

    @Override
    public List<EdgeRow> findEdgesByToNode(String toNodeId) {
        return resolveEdges(incoming.get(toNodeId));
    }

    @Override
    public List<EdgeRow> findEdgesByFromNodes(Collection<String> fromNodeIds) {
        var result = new ArrayList<EdgeRow>();
        for (var id : new LinkedHashSet<>(fromNodeIds)) {
            result.addAll(resolveEdges(outgoing.get(id)));
        }
        return result;
    }

    @Override
    public Map<String, Set<String>> findNeighborIdsMap(Collection<String> nodeIds) {
        var result = new LinkedHashMap<String, Set<String>>();
        for (var id : new LinkedHashSet<>(nodeIds)) {
            var neighbors = new LinkedHashSet<String>();
            for (var edge : resolveEdges(outgoing.get(id))) {
                neighbors.add(edge.toNodeId());
            }
            if (!neighbors.isEmpty()) {
                result.put(id, neighbors);
            }
        }
        return result;
    }

    @Override
    public int deleteEdgesByFromNode(String fromNodeId) {
        return deleteAll(outgoing.get(fromNodeId));
    }

    @Override
    public int deleteEdgesByToNode(String toNodeId) {
        return deleteAll(incoming.get(toNodeId));
    }

    @Override
    public long countEdges() {
        return edges.size();
    }

    // ==================== Maintenance ====================

    @Override
    public List<String> findOrphanNodeIds(int limit) {
        return nodes.keySet().stream()
                .filter(id -> isEmpty(outgoing.get(id)) && isEmpty(incoming.get(id)))
                .sorted()
                .limit(limit)
                .toList();
    }

    @Override
    public List<NodeRow> findAllNodes() {
        return List.copyOf(nodes.values());
    }

    @Override
    public List<EdgeRow> findAllEdges() {
        return List.copyOf(edges.values());
    }

    @Override
    public void clear() {
        edges.clear();
        outgoing.clear();
        incoming.clear();
        nodes.clear();
        log.debug("InMemoryGraphRepository cleared");
    }

    /**
     * Number of nodes with at least one indexed edge in either direction.
     */
    int indexedNodeCount() {
        var ids = new HashSet<>(outgoing.keySet());
        ids.addAll(incoming.keySet());
        return ids.size();
    }

    // ==================== Helper Methods ====================

    private void index(Map<String, Set<String>> index, String nodeId, String edgeId) {
        index.compute(nodeId, (key, ids) -> {
            var result = ids == null ? new CopyOnWriteArraySet<String>() : ids;
            result.add(edgeId);
            return result;
        });
    }

    private void unindex(Map<String, Set<String>> index, String nodeId, String edgeId) {
        index.computeIfPresent(nodeId, (key, ids) -> {
            ids.remove(edgeId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private List<EdgeRow> resolveEdges(Set<String> edgeIds) {
        if (edgeIds == null) {
            return List.of();
        }
        var result = new ArrayList<EdgeRow>(edgeIds.size());
        for (var edgeId : edgeIds) {
            var row = edges.get(edgeId);
            if (row != null) {
                result.add(row);
            }
        }
        return result;
    }

    private int deleteAll(Set<String> edgeIds) {
        if (edgeIds == null) {
            return 0;
        }
        int deleted = 0;
        for (var edgeId : List.copyOf(edgeIds)) {
            if (deleteEdgeById(edgeId)) {
                deleted++;
            }
        }
        return deleted;
    }

    private static boolean isEmpty(Set<String> ids) {
        return ids == null || ids.isEmpty();
    }
}
