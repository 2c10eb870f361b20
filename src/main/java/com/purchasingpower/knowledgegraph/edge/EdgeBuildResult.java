package com.purchasingpower.knowledgegraph.edge;

import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.OperationError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeBuildResult {

    private boolean success;
    private String operationId;

    @Builder.Default
    private List<GraphRelationship> edges = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> relationshipTypes = new LinkedHashMap<>();

    private WeightDistribution weightDistribution;

    private int totalCandidates;

    /** Candidates dropped before any store access because they were malformed. */
    private int skippedInvalid;

    /** Proximity-only candidates dropped because proximity edges are disabled. */
    private int filtered;

    @Builder.Default
    private List<EdgeFailure> failures = new ArrayList<>();

    private long durationMs;

    private OperationError error;

    public int getEdgesCreated() {
        return edges.size();
    }

    public int getEdgesFailed() {
        return failures.size();
    }
}
