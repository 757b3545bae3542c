package com.purchasingpower.memory.storage.impl;

import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.exception.MemoryValidationException;
import com.purchasingpower.memory.exception.StoreUnavailableException;
import com.purchasingpower.memory.model.CallContext;
import com.purchasingpower.memory.model.ServiceType;
import com.purchasingpower.memory.storage.GraphNodeRef;
import com.purchasingpower.memory.storage.GraphStatistics;
import com.purchasingpower.memory.storage.GraphStore;
import com.purchasingpower.memory.storage.ReadOnlyQueryGuard;
import com.purchasingpower.memory.storage.RelatedNode;
import com.purchasingpower.memory.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Relationship;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Every memory node carries the shared {@code :Memory} label plus its type label
 * (e.g. {@code :Design}), so lookups by {@code memory_id} use one index regardless of type.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Neo4jGraphStore implements GraphStore {

    static final int MAX_DEPTH = 5;
    static final int MAX_RELATED = 50;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Z][A-Za-z0-9_]{0,63}$");
    private static final String STORE_NAME = "Neo4j";

    private final Driver driver;
    private final Clock clock;

    @PostConstruct
    public void init() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX memory_id IF NOT EXISTS FOR (m:Memory) ON (m.memory_id)");
            session.run("CREATE INDEX memory_project IF NOT EXISTS FOR (m:Memory) ON (m.project_id)");
            log.info("✅ Neo4j memory indexes ready");
        } catch (Neo4jException e) {
            // the store may come up after us; lookups still work without the indexes
            log.warn("⚠️  Failed to create Neo4j indexes: {}", e.getMessage());
        }
    }

    @Override
    public void createNode(String projectId, String label, String memoryId, Map<String, Object> properties) {
        String cypher = """
            MERGE (n:Memory {memory_id: $memoryId, project_id: $projectId})
            SET n += $props,
                n:%s,
                n.created_at = coalesce(n.created_at, $now),
                n.deleted = false
            """.formatted(checkIdentifier(label));

        write("CreateNode", cypher, createParams(
                "memoryId", memoryId,
                "projectId", projectId,
                "props", properties,
                "now", now()
        ));
    }

    @Override
    public boolean updateNode(String projectId, String memoryId, Map<String, Object> properties) {
        String cypher = """
            MATCH (n:Memory {memory_id: $memoryId, project_id: $projectId})
            SET n += $props, n.updated_at = $now
            """;

        int updated = write("UpdateNode", cypher, createParams(
                "memoryId", memoryId,
                "projectId", projectId,
                "props", properties,
                "now", now()
        ), result -> result.consume().counters().propertiesSet());
        return updated > 0;
    }

    @Override
    public boolean deleteNode(String projectId, String memoryId) {
        String cypher = """
            MATCH (n:Memory {memory_id: $memoryId, project_id: $projectId})
            SET n.deleted = true, n.updated_at = $now
            """;

        int updated = write("SoftDeleteNode", cypher, createParams(
                "memoryId", memoryId,
                "projectId", projectId,
                "now", now()
        ), result -> result.consume().counters().propertiesSet());
        return updated > 0;
    }

    @Override
    public boolean removeNode(String projectId, String memoryId) {
        String cypher = """
            MATCH (n:Memory {memory_id: $memoryId, project_id: $projectId})
            DETACH DELETE n
            """;

        int deleted = write("RemoveNode", cypher, createParams(
                "memoryId", memoryId,
                "projectId", projectId
        ), result -> result.consume().counters().nodesDeleted());
        return deleted > 0;
    }

    @Override
    public List<GraphNodeRef> listNodes(String projectId) {
        String cypher = """
            MATCH (n:Memory {project_id: $projectId})
            RETURN n.memory_id AS memoryId, n.type AS type, coalesce(n.deleted, false) AS deleted
            """;

        return read("ListNodes", cypher, createParams("projectId", projectId), AccessMode.READ, result -> {
            List<GraphNodeRef> nodes = new ArrayList<>();
            while (result.hasNext()) {
                Record record = result.next();
                nodes.add(new GraphNodeRef(
                        record.get("memoryId").asString(null),
                        record.get("type").asString(null),
                        record.get("deleted").asBoolean(false)));
            }
            return nodes;
        });
    }

    @Override
    public boolean createRelationship(String projectId, String sourceId, String relationshipType,
                                      String targetId, Map<String, Object> properties) {
        String cypher = """
            MATCH (a:Memory {memory_id: $sourceId, project_id: $projectId})
            MATCH (b:Memory {memory_id: $targetId, project_id: $projectId})
            MERGE (a)-[r:%s]->(b)
            SET r += $props, r.created_at = coalesce(r.created_at, $now)
            RETURN count(r) AS created
            """.formatted(checkIdentifier(relationshipType));

        int created = write("CreateRelationship", cypher, createParams(
                "sourceId", sourceId,
                "targetId", targetId,
                "projectId", projectId,
                "props", properties,
                "now", now()
        ), result -> result.hasNext() ? result.single().get("created").asInt() : 0);
        return created > 0;
    }

    @Override
    public int deleteRelationships(String projectId, String sourceId, String origin) {
        String cypher = """
            MATCH (a:Memory {memory_id: $sourceId, project_id: $projectId})-[r]->()
            WHERE r.origin = $origin
            DELETE r
            """;

        return write("DeleteRelationships", cypher, createParams(
                "sourceId", sourceId,
                "projectId", projectId,
                "origin", origin
        ), result -> result.consume().counters().relationshipsDeleted());
    }

    @Override
    public List<RelatedNode> getRelated(String projectId, String memoryId, List<String> relationshipTypes, int depth) {
        if (depth < 1 || depth > MAX_DEPTH) {
            throw new MemoryValidationException("Depth must be between 1 and " + MAX_DEPTH + ": " + depth);
        }
        String typeFilter = "";
        if (relationshipTypes != null && !relationshipTypes.isEmpty()) {
            List<String> checked = new ArrayList<>();
            for (String type : relationshipTypes) {
                checked.add(checkIdentifier(type));
            }
            typeFilter = ":" + String.join("|", checked);
        }

        String cypher = """
            MATCH (start:Memory {memory_id: $memoryId, project_id: $projectId})
            MATCH path = (start)-[%s*1..%d]-(related:Memory)
            WHERE related.project_id = $projectId
              AND related <> start
              AND (related.deleted IS NULL OR related.deleted = false)
            WITH related, min(length(path)) AS distance
            RETURN related, distance
            ORDER BY distance
            LIMIT %d
            """.formatted(typeFilter, depth, MAX_RELATED);

        return read("GetRelated", cypher, createParams("memoryId", memoryId, "projectId", projectId),
                AccessMode.READ, result -> {
                    List<RelatedNode> related = new ArrayList<>();
                    while (result.hasNext()) {
                        Record record = result.next();
                        Node node = record.get("related").asNode();
                        Map<String, Object> props = new LinkedHashMap<>(node.asMap());
                        related.add(RelatedNode.builder()
                                .memoryId((String) props.get("memory_id"))
                                .type((String) props.get("type"))
                                .properties(props)
                                .distance(record.get("distance").asInt())
                                .build());
                    }
                    return related;
                });
    }

    @Override
    public List<Map<String, Object>> query(String projectId, String cypher, Map<String, Object> params) {
        ReadOnlyQueryGuard.check(cypher);

        Map<String, Object> bound = new HashMap<>();
        if (params != null) {
            bound.putAll(params);
        }
        bound.put("projectId", projectId);

        return read("Query", cypher, bound, AccessMode.READ, result -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            while (result.hasNext()) {
                rows.add(result.next().asMap(this::convertValue));
            }
            return rows;
        });
    }

    @Override
    public GraphStatistics statistics(String projectId) {
        String nodesCypher = """
            MATCH (n:Memory {project_id: $projectId})
            WHERE n.deleted IS NULL OR n.deleted = false
            RETURN n.type AS type, count(n) AS total
            """;
        String relsCypher = """
            MATCH (:Memory {project_id: $projectId})-[r]->(:Memory {project_id: $projectId})
            RETURN type(r) AS type, count(r) AS total
            """;

        Map<String, Object> params = createParams("projectId", projectId);
        Map<String, Long> nodesByType = read("NodeStats", nodesCypher, params, AccessMode.READ, this::countsByKey);
        Map<String, Long> relsByType = read("RelationshipStats", relsCypher, params, AccessMode.READ, this::countsByKey);

        return GraphStatistics.builder()
                .nodeCount(nodesByType.values().stream().mapToLong(Long::longValue).sum())
                .relationshipCount(relsByType.values().stream().mapToLong(Long::longValue).sum())
                .nodesByType(nodesByType)
                .relationshipsByType(relsByType)
                .build();
    }

    private Map<String, Long> countsByKey(Result result) {
        Map<String, Long> counts = new LinkedHashMap<>();
        while (result.hasNext()) {
            Record record = result.next();
            counts.put(record.get("type").asString("unknown"), record.get("total").asLong());
        }
        return counts;
    }

    private void write(String operation, String cypher, Map<String, Object> params) {
        write(operation, cypher, params, result -> {
            result.consume();
            return 0;
        });
    }

    private <T> T write(String operation, String cypher, Map<String, Object> params, Function<Result, T> mapper) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest("Query", cypher, "Parameters", params);
        try (Session session = driver.session()) {
            T value = session.executeWrite(tx -> mapper.apply(tx.run(cypher, params)));
            ctx.logResponse("Result", value);
            return value;
        } catch (Neo4jException e) {
            throw translate(ctx, e);
        }
    }

    private <T> T read(String operation, String cypher, Map<String, Object> params,
                       AccessMode mode, Function<Result, T> mapper) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest("Query", cypher, "Parameters", params);
        SessionConfig config = SessionConfig.builder().withDefaultAccessMode(mode).build();
        try (Session session = driver.session(config)) {
            T value = session.executeRead(tx -> mapper.apply(tx.run(cypher, params)));
            ctx.logResponse("Result", value instanceof List<?> list ? list.size() + " rows" : value);
            return value;
        } catch (Neo4jException e) {
            throw translate(ctx, e);
        }
    }

    private MemoryServiceException translate(CallContext ctx, Neo4jException e) {
        ctx.logError(e.getMessage(), e);
        if (e instanceof ClientException) {
            return new MemoryValidationException("Graph query failed: " + e.getMessage());
        }
        return new StoreUnavailableException(STORE_NAME, e.getMessage(), e);
    }

    private Object convertValue(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        Object raw = value.asObject();
        if (raw instanceof Node node) {
            Map<String, Object> map = new LinkedHashMap<>(node.asMap());
            map.put("_labels", node.labels());
            return map;
        }
        if (raw instanceof Relationship relationship) {
            Map<String, Object> map = new LinkedHashMap<>(relationship.asMap());
            map.put("_type", relationship.type());
            return map;
        }
        if (raw instanceof Path path) {
            List<Map<String, Object>> nodes = new ArrayList<>();
            for (Node node : path.nodes()) {
                nodes.add(new LinkedHashMap<>(node.asMap()));
            }
            return nodes;
        }
        return raw;
    }

    private static String checkIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new MemoryValidationException("Invalid graph label or relationship type: " + identifier);
        }
        return identifier;
    }

    private String now() {
        return clock.instant().toString();
    }

    private Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            params.put(key, value != null ? value : "");
        }
        return params;
    }
}
