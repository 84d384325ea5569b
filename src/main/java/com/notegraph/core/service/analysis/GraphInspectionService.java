package com.notegraph.core.service.analysis;

import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.GraphNode;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.alg.clustering.LabelPropagationClustering;
import org.jgrapht.alg.scoring.PageRank;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.ToIntFunction;

/**
 * Graph algorithms over a freshly built analysis topology.
 *
 * Every call builds its own analyzer and closes it before returning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphInspectionService {

    private static final int RANK_FUSION_K = 60;
    private static final long CLUSTERING_SEED = 42L;

    private final GraphAnalyzerFactory analyzerFactory;
    private final RelationshipStore store;
    private final MetricsConfig metricsConfig;

    // ==================== Path Finding ====================

    /**
     * Shortest path between two nodes, ignoring edge direction.
     *
     * @return node ids from start to end, or empty when either node is unknown or no path exists
     */
    public Optional<List<String>> findPath(String startNodeId, String endNodeId) {
        try (var analyzer = analyzerFactory.create()) {
            var topology = build(analyzer, null);
            if (!topology.containsNode(startNodeId) || !topology.containsNode(endNodeId)) {
                log.debug("Path lookup skipped, unknown endpoint: {} -> {}", startNodeId, endNodeId);
                return Optional.empty();
            }
            var path = new BFSShortestPath<>(topology.undirected()).getPath(startNodeId, endNodeId);
            return Optional.ofNullable(path).map(found -> List.copyOf(found.getVertexList()));
        }
    }

    // ==================== Key Nodes ====================

    /**
     * Ranks nodes by fusing their out-degree, in-degree and PageRank positions.
     */
    public List<KeyNode> findKeyNodes(int limit) {
        try (var analyzer = analyzerFactory.create()) {
            var topology = build(analyzer, null);
            if (topology.nodeCount() == 0) {
                return List.of();
            }

            var pageRank = new PageRank<>(topology.directed()).getScores();
            var nodeIds = new ArrayList<>(new TreeSet<>(topology.nodeIds()));

            var fused = new HashMap<String, Double>();
            accumulateRanks(fused, rankBy(nodeIds, topology::outDegree));
            accumulateRanks(fused, rankBy(nodeIds, topology::inDegree));
            accumulateRanks(fused, rankByScore(nodeIds, pageRank));

            return nodeIds.stream()
                    .sorted(Comparator.comparingDouble((String id) -> fused.get(id)).reversed()
                            .thenComparing(Comparator.naturalOrder()))
                    .limit(limit)
                    .map(id -> new KeyNode(
                            id,
                            analyzer.metadata().labelOf(id),
                            topology.outDegree(id),
                            topology.inDegree(id),
                            pageRank.getOrDefault(id, 0.0),
                            fused.get(id)))
                    .toList();
        }
    }

    // ==================== Communities ====================

    /**
     * Label-propagation communities of the neighborhood around the given centers
     * (the whole graph when no center is given), largest first.
     */
    public List<Set<String>> detectCommunities(Collection<String> centerNodeIds) {
        try (var analyzer = analyzerFactory.create()) {
            var topology = build(analyzer, centerNodeIds);
            if (topology.nodeCount() == 0) {
                return List.of();
            }
            var clustering = new LabelPropagationClustering<>(topology.undirected(), new Random(CLUSTERING_SEED))
                    .getClustering();

            var communities = new ArrayList<Set<String>>();
            clustering.getClusters().forEach(cluster -> communities.add(Set.copyOf(cluster)));
            communities.sort(Comparator.comparingInt((Set<String> c) -> c.size()).reversed()
                    .thenComparing(c -> new TreeSet<>(c).first()));
            log.debug("Detected {} communities over {} nodes", communities.size(), topology.nodeCount());
            return communities;
        }
    }

    // ==================== Orphans ====================

    /**
     * Nodes without any edge.
     */
    public List<GraphNode> findOrphans(int limit) {
        var result = new ArrayList<GraphNode>();
        for (var id : store.findOrphanNodeIds(limit)) {
            store.getNode(id).ifPresent(result::add);
        }
        return result;
    }

    // ==================== Helper Methods ====================

    private TopologyGraph build(InMemoryGraphAnalyzer analyzer, Collection<String> centers) {
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            return analyzer.buildGraph(centers);
        } finally {
            sample.stop(metricsConfig.getAnalysisBuildTimer());
        }
    }

    private static List<String> rankBy(List<String> nodeIds, ToIntFunction<String> measure) {
        return nodeIds.stream()
                .sorted(Comparator.comparingInt(measure).reversed().thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private static List<String> rankByScore(List<String> nodeIds, Map<String, Double> scores) {
        return nodeIds.stream()
                .sorted(Comparator.comparingDouble((String id) -> scores.getOrDefault(id, 0.0)).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private static void accumulateRanks(Map<String, Double> fused, List<String> ranking) {
        for (int i = 0; i < ranking.size(); i++) {
            fused.merge(ranking.get(i), 1.0 / (RANK_FUSION_K + i + 1), Double::sum);
        }
    }
}
