package com.purchasingpower.knowledgegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ranking scope. All fields are optional; an empty request ranks the whole graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankRequest {

    private List<String> entityIds;
    private String entityType;
    private Double minConfidence;
}
