package com.purchasingpower.knowledgegraph.edge;

import com.purchasingpower.knowledgegraph.core.GraphRelationship;

import java.util.List;

/**
 * Summary of the weights written in one batch. Buckets: high {@code >= 0.8},
 * medium {@code >= 0.5}, low below that.
 */
public record WeightDistribution(double min, double max, double average, int high, int medium, int low) {

    public static WeightDistribution of(List<GraphRelationship> edges) {
        if (edges == null || edges.isEmpty()) {
            return new WeightDistribution(0.0, 0.0, 0.0, 0, 0, 0);
        }
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0.0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (GraphRelationship edge : edges) {
            double weight = edge.getWeight();
            min = Math.min(min, weight);
            max = Math.max(max, weight);
            sum += weight;
            if (weight >= 0.8) {
                high++;
            } else if (weight >= 0.5) {
                medium++;
            } else {
                low++;
            }
        }
        return new WeightDistribution(min, max, sum / edges.size(), high, medium, low);
    }
}
