package com.purchasingpower.knowledgegraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class RankingProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double dampingFactor = 0.85;

    @Positive
    private int maxIterations = 100;

    /** Per-node convergence tolerance; iteration stops when the L1 delta drops below N * tolerance. */
    @Positive
    private double tolerance = 1e-6;

    /** Lower bound applied to stored edge weights so that every edge still carries some rank. */
    @Positive
    private double minEdgeWeight = 0.01;

    @Positive
    private int topEntitiesLimit = 10;
}
