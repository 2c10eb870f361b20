package com.purchasingpower.knowledgegraph.knowledge;

import com.purchasingpower.knowledgegraph.core.GraphEntity;

import java.util.List;

/**
 * Read-only copy of (part of) the graph taken for one ranker run.
 */
public record GraphSnapshot(List<GraphEntity> entities, List<Edge> edges) {

    public record Edge(String sourceId, String targetId, String relationshipType, double weight) {
    }

    public int nodeCount() {
        return entities.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
