package com.purchasingpower.knowledgegraph.knowledge;

import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.RankedEntity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Interface for the property-graph datastore.
 *
 * <p>Every pipeline stage reads the previous stage's output through this interface instead of
 * receiving it in memory, so stages can be retried independently. Implementations throw
 * {@link com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException} when the
 * store cannot be reached and
 * {@link com.purchasingpower.knowledgegraph.exception.GraphStoreException} when one statement
 * fails.
 */
public interface GraphStore {

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Fail fast when the store cannot be reached.
     */
    void verifyConnectivity();

    /**
     * Create the lookup indexes if they do not exist yet.
     */
    void createIndexes();

    // =========================================================================
    // Entity Operations
    // =========================================================================

    /**
     * Merge entities on {@code entity_id} in a single transaction: either every entity is
     * written or none is. Re-storing an existing id updates it in place.
     *
     * @param entities Entities to store
     * @return Entities as persisted, in input order
     */
    List<GraphEntity> storeEntities(List<GraphEntity> entities);

    Optional<GraphEntity> getEntity(String entityId);

    /**
     * One existence check for a whole set of ids.
     *
     * @param entityIds Ids to look up
     * @return The subset of ids that exist
     */
    Set<String> findExistingEntityIds(Collection<String> entityIds);

    /**
     * Case-insensitive substring search on canonical names and surface forms.
     *
     * @param namePattern Fragment to look for, or null for any name
     * @param entityType Entity type filter, or null
     * @param limit Maximum entities returned
     * @return Matches ordered by rank score (descending) then entity id
     */
    List<GraphEntity> searchEntities(String namePattern, String entityType, int limit);

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    /**
     * Create one directed edge. The endpoints are matched in the same statement, so the edge
     * is never written when either is missing.
     *
     * @param relationship Edge with a sanitized relationship type
     * @return Store-assigned element id, or empty when an endpoint does not exist
     */
    Optional<String> createRelationship(GraphRelationship relationship);

    /**
     * Edges filtered by relationship type and weight range.
     *
     * @param relationshipType Sanitized relationship type, or null for any type
     * @param minWeight Inclusive lower weight bound, or null
     * @param maxWeight Inclusive upper weight bound, or null
     * @param limit Maximum edges returned
     * @return Matches ordered by weight (descending) then relationship id
     */
    List<GraphRelationship> searchRelationships(String relationshipType, Double minWeight, Double maxWeight,
                                                int limit);

    // =========================================================================
    // Ranking Operations
    // =========================================================================

    GraphSnapshot loadGraph(RankScope scope);

    /**
     * Write score, rank, percentile and calculation time onto each entity in one transaction.
     */
    void storeRankScores(List<RankedEntity> rankedEntities);

    List<RankedEntity> findTopRankedEntities(int limit, String entityType, Double minScore);

    // =========================================================================
    // Traversal Operations
    // =========================================================================

    /**
     * Edges adjacent to any of {@code entityIds}, ordered by source id, neighbor id,
     * relationship type and relationship id.
     *
     * @param entityIds Frontier to expand
     * @param direction Edge direction to follow
     * @param relationshipTypes Allowed relationship types, or null for all
     * @param limit Maximum hops returned
     */
    List<NeighborHop> findNeighbors(Collection<String> entityIds, TraversalDirection direction,
                                    Set<String> relationshipTypes, int limit);

    GraphStatistics getStatistics();
}
