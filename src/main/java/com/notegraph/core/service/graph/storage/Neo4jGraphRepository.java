package com.notegraph.core.service.graph.storage;

import com.notegraph.core.service.config.NoteGraphConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * GraphRepository backed by Neo4j.
 *
 * Nodes are {@code :GraphNode} vertices keyed by {@code id}; edges are {@code :GRAPH_EDGE}
 * relationships carrying their own {@code id}, so several edge types can join the same
 * ordered pair. Both endpoints must exist before an edge is saved.
 */
@Slf4j
public class Neo4jGraphRepository implements GraphRepository {

    private static final String EDGE_PROJECTION = "RETURN r, a.id AS fromId, b.id AS toId";

    private final Driver driver;
    private final NoteGraphConfig.Neo4jConfig neo4jConfig;

    public Neo4jGraphRepository(Driver driver, NoteGraphConfig noteGraphConfig) {
        this.driver = driver;
        this.neo4jConfig = noteGraphConfig.getNeo4j();
    }

    @PostConstruct
    void init() {
        try (Session session = openSession()) {
            session.run("CREATE CONSTRAINT graph_node_id IF NOT EXISTS "
                    + "FOR (n:GraphNode) REQUIRE n.id IS UNIQUE").consume();
            session.run("CREATE INDEX graph_edge_id IF NOT EXISTS "
                    + "FOR ()-[r:GRAPH_EDGE]-() ON (r.id)").consume();
        }
        log.info("Neo4jGraphRepository initialized against {}", neo4jConfig.getUri());
    }

    // ==================== Nodes ====================

    @Override
    public Optional<NodeRow> findNodeById(String id) {
        return readList("MATCH (n:GraphNode {id: $id}) RETURN n",
                Map.of("id", id), this::toNodeRow).stream().findFirst();
    }

    @Override
    public List<NodeRow> findNodesByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return readList("UNWIND $ids AS nodeId MATCH (n:GraphNode {id: nodeId}) RETURN n",
                Map.of("ids", distinct(ids)), this::toNodeRow);
    }

    @Override
    public List<NodeRow> findNodesByType(String type) {
        return readList("MATCH (n:GraphNode {type: $type}) RETURN n ORDER BY n.id",
                Map.of("type", type), this::toNodeRow);
    }

    @Override
    public Set<String> findIdsByIdsAndTypes(Collection<String> ids, Collection<String> types) {
        if (ids.isEmpty() || types.isEmpty()) {
            return Set.of();
        }
        var found = readList(
                "UNWIND $ids AS nodeId MATCH (n:GraphNode {id: nodeId}) WHERE n.type IN $types RETURN n.id AS id",
                Map.of("ids", distinct(ids), "types", List.copyOf(types)),
                record -> record.get("id").asString());
        return new LinkedHashSet<>(found);
    }

    @Override
    public void saveNode(NodeRow row) {
        write("""
                MERGE (n:GraphNode {id: $id}) \
                SET n.type = $type, n.label = $label, n.attributes = $attributes, \
                n.createdAt = $createdAt, n.updatedAt = $updatedAt""",
                Map.of(
                        "id", row.id(),
                        "type", row.type(),
                        "label", row.label(),
                        "attributes", row.attributes(),
                        "createdAt", row.createdAt().toString(),
                        "updatedAt", row.updatedAt().toString()
                ));
    }

    @Override
    public boolean deleteNodeById(String id) {
        return writeCount("MATCH (n:GraphNode {id: $id}) DELETE n RETURN count(n) AS affected",
                Map.of("id", id)) > 0;
    }

    @Override
    public long countNodes() {
        return readCount("MATCH (n:GraphNode) RETURN count(n) AS total");
    }

    // ==================== Edges ====================

    @Override
    public Optional<EdgeRow> findEdgeById(String id) {
        return readList("MATCH (a:GraphNode)-[r:GRAPH_EDGE {id: $id}]->(b:GraphNode) " + EDGE_PROJECTION,
                Map.of("id", id), this::toEdgeRow).stream().findFirst();
    }

    @Override
    public void saveEdge(EdgeRow row) {
        var saved = writeCount("""
                MATCH (a:GraphNode {id: $fromId}), (b:GraphNode {id: $toId}) \
                MERGE (a)-[r:GRAPH_EDGE {id: $id}]->(b) \
                SET r.type = $type, r.weight = $weight, r.attributes = $attributes, \
                r.createdAt = $createdAt, r.updatedAt = $updatedAt \
                RETURN count(r) AS affected""",
                Map.of(
                        "id", row.id(),
                        "fromId", row.fromNodeId(),
                        "toId", row.toNodeId(),
                        "type", row.type(),
                        "weight", row.weight(),
                        "attributes", row.attributes(),
                        "createdAt", row.createdAt().toString(),
                        "updatedAt", row.updatedAt().toString()
                ));
        if (saved == 0) {
            throw new IllegalStateException("Cannot save edge %s: endpoint %s or %s does not exist"
                    .formatted(row.id(), row.fromNodeId(), row.toNodeId()));
        }
    }

    @Override
    public boolean deleteEdgeById(String id) {
        return writeCount("MATCH ()-[r:GRAPH_EDGE {id: $id}]->() DELETE r RETURN count(r) AS affected",
                Map.of("id", id)) > 0;
    }

    @Override
    public List<EdgeRow> findEdgesByFromNode(String fromNodeId) {
        return readList("MATCH (a:GraphNode {id: $id})-[r:GRAPH_EDGE]->(b:GraphNode) "
                        + EDGE_PROJECTION + " ORDER BY datetime(r.createdAt), r.id",
                Map.of("id", fromNodeId), this::toEdgeRow);
    }

    @Override
    public List<EdgeRow> findEdgesByToNode(String toNodeId) {
        return readList("MATCH (a:GraphNode)-[r:GRAPH_EDGE]->(b:GraphNode {id: $id}) "
                        + EDGE_PROJECTION + " ORDER BY datetime(r.createdAt), r.id",
                Map.of("id", toNodeId), this::toEdgeRow);
    }

    @Override
    public List<EdgeRow> findEdgesByFromNodes(Collection<String> fromNodeIds) {
        if (fromNodeIds.isEmpty()) {
            return List.of();
        }
        return readList("MATCH (a:GraphNode)-[r:GRAPH_EDGE]->(b:GraphNode) WHERE a.id IN $ids "
                        + EDGE_PROJECTION + " ORDER BY a.id, datetime(r.createdAt), r.id",
                Map.of("ids", distinct(fromNodeIds)), this::toEdgeRow);
    }

    @Override
    public Map<String, Set<String>> findNeighborIdsMap(Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return Map.of();
        }
        var pairs = readList("""
                MATCH (a:GraphNode)-[r:GRAPH_EDGE]->(b:GraphNode) WHERE a.id IN $ids \
                RETURN a.id AS fromId, b.id AS toId ORDER BY datetime(r.createdAt), r.id""",
                Map.of("ids", distinct(nodeIds)),
                record -> Map.entry(record.get("fromId").asString(), record.get("toId").asString()));

        var result = new LinkedHashMap<String, Set<String>>();
        for (var pair : pairs) {
            result.computeIfAbsent(pair.getKey(), key -> new LinkedHashSet<>()).add(pair.getValue());
        }
        return result;
    }

    @Override
    public int deleteEdgesByFromNode(String fromNodeId) {
        return (int) writeCount("MATCH (a:GraphNode {id: $id})-[r:GRAPH_EDGE]->() DELETE r RETURN count(r) AS affected",
                Map.of("id", fromNodeId));
    }

    @Override
    public int deleteEdgesByToNode(String toNodeId) {
        return (int) writeCount("MATCH ()-[r:GRAPH_EDGE]->(b:GraphNode {id: $id}) DELETE r RETURN count(r) AS affected",
                Map.of("id", toNodeId));
    }

    @Override
    public long countEdges() {
        return readCount("MATCH ()-[r:GRAPH_EDGE]->() RETURN count(r) AS total");
    }

    // ==================== Maintenance ====================

    @Override
    public List<String> findOrphanNodeIds(int limit) {
        return readList("MATCH (n:GraphNode) WHERE NOT (n)--() RETURN n.id AS id ORDER BY id LIMIT $limit",
                Map.of("limit", limit), record -> record.get("id").asString());
    }

    @Override
    public List<NodeRow> findAllNodes() {
        return readList("MATCH (n:GraphNode) RETURN n ORDER BY n.id", Map.of(), this::toNodeRow);
    }

    @Override
    public List<EdgeRow> findAllEdges() {
        return readList("MATCH (a:GraphNode)-[r:GRAPH_EDGE]->(b:GraphNode) " + EDGE_PROJECTION + " ORDER BY r.id",
                Map.of(), this::toEdgeRow);
    }

    @Override
    public void clear() {
        write("MATCH (n:GraphNode) DETACH DELETE n", Map.of());
        log.info("Neo4j graph cleared");
    }

    // ==================== Session Helpers ====================

    private Session openSession() {
        var database = neo4jConfig.getDatabase();
        if (database == null || database.isBlank()) {
            return driver.session();
        }
        return driver.session(SessionConfig.forDatabase(database));
    }

    private <T> List<T> readList(String cypher, Map<String, Object> params,
                                 Function<Record, T> mapper) {
        try (Session session = openSession()) {
            return session.executeRead(tx -> tx.run(cypher, params).list(mapper));
        }
    }

    private long readCount(String cypher) {
        try (Session session = openSession()) {
            return session.executeRead(tx -> tx.run(cypher).single().get("total").asLong());
        }
    }

    private void write(String cypher, Map<String, Object> params) {
        try (Session session = openSession()) {
            session.executeWrite(tx -> tx.run(cypher, params).consume());
        }
    }

    private long writeCount(String cypher, Map<String, Object> params) {
        try (Session session = openSession()) {
            return session.executeWrite(tx -> tx.run(cypher, params).single().get("affected").asLong());
        }
    }

    // ==================== Mapping ====================

    private NodeRow toNodeRow(Record record) {
        var node = record.get("n").asNode();
        return new NodeRow(
                node.get("id").asString(),
                node.get("type").asString(),
                node.get("label").asString(null),
                node.get("attributes").asString(null),
                toInstant(node.get("createdAt")),
                toInstant(node.get("updatedAt"))
        );
    }

    private EdgeRow toEdgeRow(Record record) {
        var rel = record.get("r").asRelationship();
        return new EdgeRow(
                rel.get("id").asString(),
                record.get("fromId").asString(),
                record.get("toId").asString(),
                rel.get("type").asString(),
                rel.get("weight").asDouble(),
                rel.get("attributes").asString(null),
                toInstant(rel.get("createdAt")),
                toInstant(rel.get("updatedAt"))
        );
    }

    private static Instant toInstant(Value value) {
        return value.isNull() ? null : Instant.parse(value.asString());
    }

    private static List<String> distinct(Collection<String> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
