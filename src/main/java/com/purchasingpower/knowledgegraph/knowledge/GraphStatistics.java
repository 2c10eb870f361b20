package com.purchasingpower.knowledgegraph.knowledge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {

    private long totalEntities;
    private long totalRelationships;
    private double graphDensity;

    @Builder.Default
    private Map<String, Long> entityTypeDistribution = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RelationshipTypeStats> relationshipTypeDistribution = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RelationshipTypeStats {
        private long count;
        private double averageWeight;
    }
}
