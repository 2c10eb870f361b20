package com.purchasingpower.knowledgegraph.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryStats {

    private int seedCount;
    private int pathsExplored;
    private int entitiesVisited;
    private int hopsTraversed;
    private double averageConfidence;
    private boolean truncated;
}
