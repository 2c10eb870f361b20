package com.purchasingpower.knowledgegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An entity with its importance score, position and percentile in one ranker run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedEntity {

    private String entityId;
    private String canonicalName;
    private String entityType;
    private double score;
    private int rank;
    private double percentile;
    private double entityConfidence;
    private double qualityConfidence;
    private QualityTier qualityTier;
    private Instant calculatedAt;
}
