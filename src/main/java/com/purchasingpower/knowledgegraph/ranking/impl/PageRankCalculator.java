package com.purchasingpower.knowledgegraph.ranking.impl;

import com.purchasingpower.knowledgegraph.knowledge.GraphSnapshot;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted power-iteration PageRank.
 *
 * <p>Rank held by nodes without outgoing edges is spread evenly over all nodes, so scores
 * always sum to 1. Edge weights are clamped to {@code [minEdgeWeight, 1]} and parallel edges
 * add up.
 */
public class PageRankCalculator {

    private final double dampingFactor;
    private final int maxIterations;
    private final double tolerance;
    private final double minEdgeWeight;

    public PageRankCalculator(double dampingFactor, int maxIterations, double tolerance, double minEdgeWeight) {
        if (dampingFactor < 0.0 || dampingFactor > 1.0) {
            throw new IllegalArgumentException("Damping factor must be within [0,1]: " + dampingFactor);
        }
        this.dampingFactor = dampingFactor;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.minEdgeWeight = minEdgeWeight;
    }

    public record Computation(Map<String, Double> scores, int iterations, boolean converged, boolean interrupted) {
    }

    /**
     * @param nodeIds Node ids; iteration order follows this list
     * @param edges Edges; any edge with an endpoint outside {@code nodeIds} is ignored
     */
    public Computation compute(List<String> nodeIds, List<GraphSnapshot.Edge> edges) {
        int n = nodeIds.size();
        if (n == 0) {
            return new Computation(Map.of(), 0, true, false);
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodeIds.get(i), i);
        }

        int[] sources = new int[edges.size()];
        int[] targets = new int[edges.size()];
        double[] weights = new double[edges.size()];
        double[] outWeight = new double[n];
        int edgeCount = 0;
        for (GraphSnapshot.Edge edge : edges) {
            Integer source = index.get(edge.sourceId());
            Integer target = index.get(edge.targetId());
            if (source == null || target == null) {
                continue;
            }
            double weight = Double.isNaN(edge.weight()) ? minEdgeWeight : Math.max(minEdgeWeight, Math.min(1.0, edge.weight()));
            sources[edgeCount] = source;
            targets[edgeCount] = target;
            weights[edgeCount] = weight;
            outWeight[source] += weight;
            edgeCount++;
        }

        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);
        double teleport = (1.0 - dampingFactor) / n;

        int iterations = 0;
        boolean converged = false;
        boolean interrupted = false;
        while (iterations < maxIterations) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }

            double danglingMass = 0.0;
            for (int v = 0; v < n; v++) {
                if (outWeight[v] == 0.0) {
                    danglingMass += rank[v];
                }
            }

            double[] next = new double[n];
            Arrays.fill(next, teleport + dampingFactor * danglingMass / n);
            for (int e = 0; e < edgeCount; e++) {
                int u = sources[e];
                next[targets[e]] += dampingFactor * rank[u] * weights[e] / outWeight[u];
            }

            double delta = 0.0;
            for (int v = 0; v < n; v++) {
                delta += Math.abs(next[v] - rank[v]);
            }
            rank = next;
            iterations++;

            if (delta < n * tolerance) {
                converged = true;
                break;
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scores.put(nodeIds.get(i), rank[i]);
        }
        return new Computation(scores, iterations, converged, interrupted);
    }
}
