package com.purchasingpower.knowledgegraph.edge;

import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.RelationshipCandidate;

import java.util.List;

/**
 * Verifies, weights and persists relationship candidates between existing entities.
 */
public interface EdgeBuilderService {

    /**
     * Materialize relationship candidates as weighted edges.
     *
     * <p>With {@code verifyEntities} set, every endpoint referenced by the batch is checked in
     * one call first and the whole batch is rejected, with nothing written, when any is
     * missing. Each edge is re-checked right before it is written either way. A failure on one
     * edge is recorded and the batch continues, unless the datastore becomes unreachable.
     *
     * @param relationships Candidates from the relation extractor
     * @param sourceRefs Documents or chunks the candidates came from
     * @param verifyEntities Check all endpoints up front
     * @return Build result, never null
     */
    EdgeBuildResult buildEdges(List<RelationshipCandidate> relationships, List<String> sourceRefs,
                               boolean verifyEntities);

    /**
     * Stored edges of one type, or any type, whose weight lies in {@code [minWeight, maxWeight]}.
     *
     * @param relationshipType Relationship type as the extractor named it, or null for any
     * @param minWeight Inclusive lower bound, or null
     * @param maxWeight Inclusive upper bound, or null
     * @param limit Maximum edges; zero or less uses the configured default
     * @return Edges ordered by weight (descending) then relationship id
     */
    List<GraphRelationship> searchRelationships(String relationshipType, Double minWeight, Double maxWeight,
                                                int limit);
}
