package com.purchasingpower.knowledgegraph.ranking;

import com.purchasingpower.knowledgegraph.core.RankedEntity;
import com.purchasingpower.knowledgegraph.knowledge.RankScope;

import java.util.List;

/**
 * Importance ranking over the persisted entity graph.
 */
public interface PageRankService {

    /**
     * Run weighted PageRank over the scoped subgraph and write score, rank and percentile back
     * onto each ranked entity. A graph without edges yields uniform scores.
     *
     * @param scope Subgraph to rank; null or empty ranks the whole graph
     */
    RankingResult calculatePageRank(RankScope scope);

    /**
     * Entities with the highest stored scores.
     *
     * @param limit Maximum entities; non-positive uses the configured default
     * @param entityType Type filter, or null
     * @param minScore Minimum score, or null
     */
    List<RankedEntity> getTopEntities(int limit, String entityType, Double minScore);
}
