package com.purchasingpower.knowledgegraph.knowledge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Restricts the subgraph loaded for ranking. An empty scope means the whole graph.
 * Edges are kept only when both endpoints fall inside the scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankScope {

    /** Entities linked to the documents being ingested; null means no id restriction. */
    private Set<String> entityIds;
    private String entityType;
    private Double minConfidence;

    public static RankScope wholeGraph() {
        return new RankScope();
    }

    public boolean isWholeGraph() {
        return entityIds == null && entityType == null && minConfidence == null;
    }
}
