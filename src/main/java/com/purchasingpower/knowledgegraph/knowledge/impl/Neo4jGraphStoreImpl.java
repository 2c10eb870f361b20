package com.purchasingpower.knowledgegraph.knowledge.impl;

import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.QualityTier;
import com.purchasingpower.knowledgegraph.core.RankedEntity;
import com.purchasingpower.knowledgegraph.exception.GraphStoreException;
import com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.knowledgegraph.knowledge.GraphSnapshot;
import com.purchasingpower.knowledgegraph.knowledge.GraphStatistics;
import com.purchasingpower.knowledgegraph.knowledge.GraphStore;
import com.purchasingpower.knowledgegraph.knowledge.NeighborHop;
import com.purchasingpower.knowledgegraph.knowledge.RankScope;
import com.purchasingpower.knowledgegraph.knowledge.RelationshipTypes;
import com.purchasingpower.knowledgegraph.knowledge.TraversalDirection;
import com.purchasingpower.knowledgegraph.util.StoreCallContext;
import com.purchasingpower.knowledgegraph.util.StoreCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.purchasingpower.knowledgegraph.knowledge.GraphSchema.*;

/**
 * Neo4j implementation of GraphStore interface.
 *
 * <p>Entities are {@code :Entity} nodes keyed by {@code entity_id}; relationships carry their
 * sanitized type as the Neo4j relationship type. All statements are parameterized except the
 * relationship type, which is sanitized before it is spliced in.
 */
@Slf4j
@Service
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final String STORE_ENTITIES = """
        UNWIND $entities AS row
        MERGE (e:Entity {entity_id: row.entity_id})
        ON CREATE SET e.created_at = datetime(), e.pagerank_score = 0.0
        SET e.canonical_name = row.canonical_name,
            e.entity_type = row.entity_type,
            e.surface_forms = row.surface_forms,
            e.mention_count = row.mention_count,
            e.mention_refs = row.mention_refs,
            e.source_refs = row.source_refs,
            e.confidence = row.confidence,
            e.quality_confidence = row.quality_confidence,
            e.quality_tier = row.quality_tier,
            e.updated_at = datetime()
        RETURN e
        """;

    private static final String STORE_RANK_SCORES = """
        UNWIND $ranks AS row
        MATCH (e:Entity {entity_id: row.entity_id})
        SET e.pagerank_score = row.score,
            e.pagerank_rank = row.rank,
            e.pagerank_percentile = row.percentile,
            e.pagerank_calculated_at = row.calculated_at
        """;

    private static final String SEARCH_RELATIONSHIPS = """
        MATCH (s:Entity)-[r]->(o:Entity)
        WHERE ($relationshipType IS NULL OR type(r) = $relationshipType)
          AND ($minWeight IS NULL OR r.weight >= $minWeight)
          AND ($maxWeight IS NULL OR r.weight <= $maxWeight)
        RETURN s.entity_id AS subject_id, o.entity_id AS object_id, type(r) AS rel_type, r
        ORDER BY r.weight DESC, r.relationship_id
        LIMIT $limit
        """;

    private static final String LOAD_SCOPED_ENTITIES = """
        MATCH (e:Entity)
        WHERE ($entityIds IS NULL OR e.entity_id IN $entityIds)
          AND ($entityType IS NULL OR e.entity_type = $entityType)
          AND ($minConfidence IS NULL OR e.confidence >= $minConfidence)
        RETURN e
        ORDER BY e.entity_id
        """;

    private static final String LOAD_SCOPED_EDGES = """
        MATCH (s:Entity)-[r]->(t:Entity)
        WHERE s.entity_id IN $entityIds AND t.entity_id IN $entityIds
        RETURN s.entity_id AS source_id, t.entity_id AS target_id, type(r) AS rel_type, r.weight AS weight
        ORDER BY source_id, target_id, rel_type
        """;

    private static final String FIND_NEIGHBORS = """
        MATCH (a:Entity)-[r]-(b:Entity)
        WHERE a.entity_id IN $entityIds
          AND ($direction = 'BOTH'
               OR ($direction = 'OUTGOING' AND startNode(r) = a)
               OR ($direction = 'INCOMING' AND endNode(r) = a))
          AND ($relationshipTypes IS NULL OR type(r) IN $relationshipTypes)
        RETURN a.entity_id AS from_id, r, type(r) AS rel_type, b
        ORDER BY from_id, b.entity_id, rel_type, r.relationship_id
        LIMIT $limit
        """;

    private static final String TOP_RANKED = """
        MATCH (e:Entity)
        WHERE e.pagerank_score IS NOT NULL
          AND ($entityType IS NULL OR e.entity_type = $entityType)
          AND ($minScore IS NULL OR e.pagerank_score >= $minScore)
        RETURN e
        ORDER BY e.pagerank_score DESC, e.entity_id
        LIMIT $limit
        """;

    private static final String SEARCH_ENTITIES = """
        MATCH (e:Entity)
        WHERE ($entityType IS NULL OR e.entity_type = $entityType)
          AND ($pattern IS NULL
               OR toLower(e.canonical_name) CONTAINS $pattern
               OR any(form IN coalesce(e.surface_forms, []) WHERE toLower(form) CONTAINS $pattern))
        RETURN e
        ORDER BY coalesce(e.pagerank_score, 0.0) DESC, e.entity_id
        LIMIT $limit
        """;

    private final Driver driver;
    private final String database;

    public Neo4jGraphStoreImpl(Driver driver, KnowledgeGraphProperties properties) {
        this.driver = driver;
        this.database = properties.getNeo4j().getDatabase();
    }

    @PostConstruct
    public void init() {
        try {
            createIndexes();
        } catch (RuntimeException e) {
            log.warn("Could not create Neo4j indexes at startup: {}", e.getMessage());
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Override
    public void verifyConnectivity() {
        StoreCallContext ctx = StoreCallLogger.startCall("verifyConnectivity", log);
        ctx.logRequest();
        try {
            driver.verifyConnectivity();
            ctx.logResponse();
        } catch (Neo4jException e) {
            ctx.logError("Connectivity check failed", e);
            throw new GraphStoreUnavailableException("Graph datastore is unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void createIndexes() {
        StoreCallContext ctx = StoreCallLogger.startCall("createIndexes", log);
        ctx.logRequest();
        // schema statements run as auto-commit queries, one per index
        try (Session session = driver.session(sessionConfig())) {
            session.run("CREATE INDEX entity_id_index IF NOT EXISTS FOR (e:Entity) ON (e.entity_id)").consume();
            session.run("CREATE INDEX entity_name_index IF NOT EXISTS FOR (e:Entity) ON (e.canonical_name)").consume();
            session.run("CREATE INDEX entity_type_index IF NOT EXISTS FOR (e:Entity) ON (e.entity_type)").consume();
            ctx.logResponse();
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            ctx.logError("Datastore unavailable", e);
            throw new GraphStoreUnavailableException("Graph datastore is unreachable: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            ctx.logError(e.getMessage(), e);
            throw new GraphStoreException("createIndexes", e.getMessage(), e);
        }
        log.info("Neo4j indexes created/verified");
    }

    // =========================================================================
    // Entity Operations
    // =========================================================================

    @Override
    public List<GraphEntity> storeEntities(List<GraphEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (GraphEntity entity : entities) {
            rows.add(entityParams(entity));
        }

        Map<String, GraphEntity> stored = write("storeEntities", tx -> {
            Map<String, GraphEntity> byId = new HashMap<>();
            for (Record record : tx.run(STORE_ENTITIES, Map.of("entities", rows)).list()) {
                GraphEntity entity = toEntity(record.get("e").asNode());
                byId.put(entity.getEntityId(), entity);
            }
            return byId;
        });

        List<GraphEntity> ordered = new ArrayList<>();
        for (GraphEntity entity : entities) {
            ordered.add(stored.getOrDefault(entity.getEntityId(), entity));
        }
        log.debug("Stored {} entities", ordered.size());
        return ordered;
    }

    @Override
    public Optional<GraphEntity> getEntity(String entityId) {
        return read("getEntity", tx -> {
            List<Record> records = tx.run("MATCH (e:Entity {entity_id: $entityId}) RETURN e",
                Map.of("entityId", entityId)).list();
            return records.isEmpty() ? Optional.empty() : Optional.of(toEntity(records.get(0).get("e").asNode()));
        });
    }

    @Override
    public Set<String> findExistingEntityIds(Collection<String> entityIds) {
        if (entityIds == null || entityIds.isEmpty()) {
            return Set.of();
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(entityIds));
        return read("findExistingEntityIds", tx -> {
            Set<String> existing = new LinkedHashSet<>();
            tx.run("MATCH (e:Entity) WHERE e.entity_id IN $ids RETURN e.entity_id AS id",
                    Map.of("ids", ids))
                .list()
                .forEach(record -> existing.add(record.get("id").asString()));
            return existing;
        });
    }

    @Override
    public List<GraphEntity> searchEntities(String namePattern, String entityType, int limit) {
        Map<String, Object> params = new HashMap<>();
        params.put("pattern", namePattern == null || namePattern.isBlank() ? null : namePattern.trim().toLowerCase());
        params.put("entityType", entityType);
        params.put("limit", limit);
        return read("searchEntities", tx -> tx.run(SEARCH_ENTITIES, params).list(r -> toEntity(r.get("e").asNode())));
    }

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    @Override
    public Optional<String> createRelationship(GraphRelationship relationship) {
        String type = RelationshipTypes.sanitize(relationship.getRelationshipType());
        String cypher = """
            MATCH (s:Entity {entity_id: $subjectId})
            MATCH (o:Entity {entity_id: $objectId})
            CREATE (s)-[r:`%s`]->(o)
            SET r = $props, r.created_at = datetime()
            RETURN elementId(r) AS id
            """.formatted(type);

        Map<String, Object> params = new HashMap<>();
        params.put("subjectId", relationship.getSubjectEntityId());
        params.put("objectId", relationship.getObjectEntityId());
        params.put("props", relationshipParams(relationship, type));

        return write("createRelationship", tx -> {
            List<Record> records = tx.run(cypher, params).list();
            return records.isEmpty() ? Optional.<String>empty() : Optional.of(records.get(0).get("id").asString());
        });
    }

    @Override
    public List<GraphRelationship> searchRelationships(String relationshipType, Double minWeight, Double maxWeight,
                                                       int limit) {
        Map<String, Object> params = new HashMap<>();
        params.put("relationshipType", relationshipType);
        params.put("minWeight", minWeight);
        params.put("maxWeight", maxWeight);
        params.put("limit", limit);
        return read("searchRelationships", tx -> tx.run(SEARCH_RELATIONSHIPS, params).list(this::toRelationship));
    }

    // =========================================================================
    // Ranking Operations
    // =========================================================================

    @Override
    public GraphSnapshot loadGraph(RankScope scope) {
        RankScope effective = scope != null ? scope : RankScope.wholeGraph();
        Map<String, Object> params = new HashMap<>();
        params.put("entityIds", effective.getEntityIds() != null ? new ArrayList<>(effective.getEntityIds()) : null);
        params.put("entityType", effective.getEntityType());
        params.put("minConfidence", effective.getMinConfidence());

        return read("loadGraph", tx -> {
            List<GraphEntity> entities = tx.run(LOAD_SCOPED_ENTITIES, params)
                .list(r -> toEntity(r.get("e").asNode()));
            List<String> ids = entities.stream().map(GraphEntity::getEntityId).toList();

            List<GraphSnapshot.Edge> edges = tx.run(LOAD_SCOPED_EDGES, Map.of("entityIds", ids))
                .list(r -> new GraphSnapshot.Edge(
                    r.get("source_id").asString(),
                    r.get("target_id").asString(),
                    r.get("rel_type").asString(),
                    r.get("weight").isNull() ? 0.0 : r.get("weight").asDouble()));
            return new GraphSnapshot(entities, edges);
        });
    }

    @Override
    public void storeRankScores(List<RankedEntity> rankedEntities) {
        if (rankedEntities == null || rankedEntities.isEmpty()) {
            return;
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (RankedEntity ranked : rankedEntities) {
            Map<String, Object> row = new HashMap<>();
            row.put("entity_id", ranked.getEntityId());
            row.put("score", ranked.getScore());
            row.put("rank", ranked.getRank());
            row.put("percentile", ranked.getPercentile());
            row.put("calculated_at", toDateTime(ranked.getCalculatedAt()));
            rows.add(row);
        }
        write("storeRankScores", tx -> {
            tx.run(STORE_RANK_SCORES, Map.of("ranks", rows)).consume();
            return null;
        });
    }

    @Override
    public List<RankedEntity> findTopRankedEntities(int limit, String entityType, Double minScore) {
        Map<String, Object> params = new HashMap<>();
        params.put("entityType", entityType);
        params.put("minScore", minScore);
        params.put("limit", limit);
        return read("findTopRankedEntities", tx -> tx.run(TOP_RANKED, params).list(r -> toRanked(r.get("e").asNode())));
    }

    // =========================================================================
    // Traversal Operations
    // =========================================================================

    @Override
    public List<NeighborHop> findNeighbors(Collection<String> entityIds, TraversalDirection direction,
                                           Set<String> relationshipTypes, int limit) {
        if (entityIds == null || entityIds.isEmpty()) {
            return List.of();
        }
        Map<String, Object> params = new HashMap<>();
        params.put("entityIds", new ArrayList<>(entityIds));
        params.put("direction", (direction != null ? direction : TraversalDirection.BOTH).name());
        params.put("relationshipTypes", relationshipTypes != null ? new ArrayList<>(relationshipTypes) : null);
        params.put("limit", limit);

        return read("findNeighbors", tx -> tx.run(FIND_NEIGHBORS, params).list(record -> {
            Relationship rel = record.get("r").asRelationship();
            return NeighborHop.builder()
                .fromEntityId(record.get("from_id").asString())
                .relationshipType(record.get("rel_type").asString())
                .weight(doubleOr(rel.get(WEIGHT), 0.0))
                .neighbor(toEntity(record.get("b").asNode()))
                .build();
        }));
    }

    @Override
    public GraphStatistics getStatistics() {
        return read("getStatistics", tx -> {
            Map<String, Long> entityTypes = new LinkedHashMap<>();
            long totalEntities = 0;
            for (Record record : tx.run("""
                    MATCH (e:Entity)
                    RETURN e.entity_type AS type, count(e) AS count
                    ORDER BY count DESC, type
                    """).list()) {
                long count = record.get("count").asLong();
                String type = record.get("type").isNull() ? "UNKNOWN" : record.get("type").asString();
                entityTypes.put(type, count);
                totalEntities += count;
            }

            Map<String, GraphStatistics.RelationshipTypeStats> relTypes = new LinkedHashMap<>();
            long totalRelationships = 0;
            for (Record record : tx.run("""
                    MATCH (:Entity)-[r]->(:Entity)
                    RETURN type(r) AS type, count(r) AS count, avg(r.weight) AS avg_weight
                    ORDER BY count DESC, type
                    """).list()) {
                long count = record.get("count").asLong();
                relTypes.put(record.get("type").asString(),
                    new GraphStatistics.RelationshipTypeStats(count, doubleOr(record.get("avg_weight"), 0.0)));
                totalRelationships += count;
            }

            double density = totalEntities > 1
                ? (double) totalRelationships / (totalEntities * (totalEntities - 1))
                : 0.0;

            return GraphStatistics.builder()
                .totalEntities(totalEntities)
                .totalRelationships(totalRelationships)
                .graphDensity(density)
                .entityTypeDistribution(entityTypes)
                .relationshipTypeDistribution(relTypes)
                .build();
        });
    }

    // =========================================================================
    // Session helpers
    // =========================================================================

    private <T> T read(String operation, TransactionCallback<T> work) {
        return execute(operation, true, work);
    }

    private <T> T write(String operation, TransactionCallback<T> work) {
        return execute(operation, false, work);
    }

    private <T> T execute(String operation, boolean readOnly, TransactionCallback<T> work) {
        StoreCallContext ctx = StoreCallLogger.startCall(operation, log);
        ctx.logRequest("mode", readOnly ? "read" : "write");
        try (Session session = driver.session(sessionConfig())) {
            T result = readOnly ? session.executeRead(work) : session.executeWrite(work);
            ctx.logResponse();
            return result;
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            ctx.logError("Datastore unavailable", e);
            throw new GraphStoreUnavailableException("Graph datastore is unreachable: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            ctx.logError(e.getMessage(), e);
            throw new GraphStoreException(operation, e.getMessage(), e);
        }
    }

    private SessionConfig sessionConfig() {
        if (database == null || database.isBlank()) {
            return SessionConfig.defaultConfig();
        }
        return SessionConfig.forDatabase(database);
    }

    // =========================================================================
    // Mapping
    // =========================================================================

    private Map<String, Object> entityParams(GraphEntity entity) {
        Map<String, Object> row = new HashMap<>();
        row.put(ENTITY_ID, entity.getEntityId());
        row.put(CANONICAL_NAME, entity.getCanonicalName());
        row.put(ENTITY_TYPE, entity.getEntityType());
        row.put(SURFACE_FORMS, entity.getSurfaceForms() != null ? entity.getSurfaceForms() : List.of());
        row.put(MENTION_COUNT, entity.getMentionCount());
        row.put(MENTION_REFS, entity.getMentionRefs() != null ? entity.getMentionRefs() : List.of());
        row.put(SOURCE_REFS, entity.getSourceRefs() != null ? entity.getSourceRefs() : List.of());
        row.put(CONFIDENCE, entity.getConfidence());
        row.put(QUALITY_CONFIDENCE, entity.getQualityConfidence());
        row.put(QUALITY_TIER, entity.getQualityTier() != null ? entity.getQualityTier().name() : null);
        return row;
    }

    /**
     * Relationship properties with null values left out, since Neo4j does not store nulls.
     */
    private Map<String, Object> relationshipParams(GraphRelationship relationship, String type) {
        Map<String, Object> props = new HashMap<>();
        props.put(RELATIONSHIP_ID, relationship.getRelationshipId());
        props.put(RELATIONSHIP_TYPE, type);
        props.put(WEIGHT, relationship.getWeight());
        props.put(CONFIDENCE, relationship.getConfidence());
        props.put(QUALITY_CONFIDENCE, relationship.getQualityConfidence());
        props.put(SOURCE_REFS, relationship.getSourceRefs() != null ? relationship.getSourceRefs() : List.of());
        putIfPresent(props, EXTRACTION_METHOD, relationship.getExtractionMethod());
        putIfPresent(props, EVIDENCE_TEXT, relationship.getEvidenceText());
        putIfPresent(props, PATTERN_CONFIDENCE, relationship.getPatternConfidence());
        putIfPresent(props, ENTITY_DISTANCE, relationship.getEntityDistance());
        putIfPresent(props, QUALITY_TIER, relationship.getQualityTier() != null ? relationship.getQualityTier().name() : null);
        props.values().removeIf(value -> value == null);
        return props;
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }

    private GraphEntity toEntity(Node node) {
        return GraphEntity.builder()
            .entityId(node.get(ENTITY_ID).asString())
            .canonicalName(stringOr(node.get(CANONICAL_NAME), null))
            .entityType(stringOr(node.get(ENTITY_TYPE), null))
            .surfaceForms(stringList(node.get(SURFACE_FORMS)))
            .mentionCount(node.get(MENTION_COUNT).isNull() ? 0 : node.get(MENTION_COUNT).asInt())
            .mentionRefs(stringList(node.get(MENTION_REFS)))
            .sourceRefs(stringList(node.get(SOURCE_REFS)))
            .confidence(doubleOr(node.get(CONFIDENCE), 0.0))
            .qualityConfidence(doubleOr(node.get(QUALITY_CONFIDENCE), 0.0))
            .qualityTier(tierOf(node.get(QUALITY_TIER)))
            .createdAt(instantOf(node.get(CREATED_AT)))
            .pageRankScore(doubleOr(node.get(PAGERANK_SCORE), 0.0))
            .build();
    }

    private GraphRelationship toRelationship(Record record) {
        Relationship rel = record.get("r").asRelationship();
        return GraphRelationship.builder()
            .relationshipId(rel.get(RELATIONSHIP_ID).isNull() ? rel.elementId() : rel.get(RELATIONSHIP_ID).asString())
            .subjectEntityId(record.get("subject_id").asString())
            .objectEntityId(record.get("object_id").asString())
            .relationshipType(record.get("rel_type").asString())
            .weight(doubleOr(rel.get(WEIGHT), 0.0))
            .confidence(doubleOr(rel.get(CONFIDENCE), 0.0))
            .extractionMethod(stringOr(rel.get(EXTRACTION_METHOD), null))
            .evidenceText(stringOr(rel.get(EVIDENCE_TEXT), null))
            .patternConfidence(rel.get(PATTERN_CONFIDENCE).isNull() ? null : rel.get(PATTERN_CONFIDENCE).asDouble())
            .entityDistance(rel.get(ENTITY_DISTANCE).isNull() ? null : rel.get(ENTITY_DISTANCE).asInt())
            .qualityConfidence(doubleOr(rel.get(QUALITY_CONFIDENCE), 0.0))
            .qualityTier(tierOf(rel.get(QUALITY_TIER)))
            .sourceRefs(stringList(rel.get(SOURCE_REFS)))
            .createdAt(instantOf(rel.get(CREATED_AT)))
            .build();
    }

    private RankedEntity toRanked(Node node) {
        return RankedEntity.builder()
            .entityId(node.get(ENTITY_ID).asString())
            .canonicalName(stringOr(node.get(CANONICAL_NAME), null))
            .entityType(stringOr(node.get(ENTITY_TYPE), null))
            .score(doubleOr(node.get(PAGERANK_SCORE), 0.0))
            .rank(node.get(PAGERANK_RANK).isNull() ? 0 : node.get(PAGERANK_RANK).asInt())
            .percentile(doubleOr(node.get(PAGERANK_PERCENTILE), 0.0))
            .entityConfidence(doubleOr(node.get(CONFIDENCE), 0.0))
            .qualityConfidence(doubleOr(node.get(QUALITY_CONFIDENCE), 0.0))
            .qualityTier(tierOf(node.get(QUALITY_TIER)))
            .calculatedAt(instantOf(node.get(PAGERANK_CALCULATED_AT)))
            .build();
    }

    private static String stringOr(Value value, String fallback) {
        return value == null || value.isNull() ? fallback : value.asString();
    }

    private static double doubleOr(Value value, double fallback) {
        return value == null || value.isNull() ? fallback : value.asDouble();
    }

    private static List<String> stringList(Value value) {
        return value == null || value.isNull() ? new ArrayList<>() : new ArrayList<>(value.asList(Value::asString));
    }

    private static QualityTier tierOf(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return QualityTier.valueOf(value.asString());
        } catch (IllegalArgumentException e) {
            log.debug("Unknown quality tier '{}' stored on node", value.asString());
            return null;
        }
    }

    private static Instant instantOf(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asZonedDateTime().toInstant();
    }

    private static OffsetDateTime toDateTime(Instant instant) {
        return OffsetDateTime.ofInstant(instant != null ? instant : Instant.now(), ZoneOffset.UTC);
    }
}
