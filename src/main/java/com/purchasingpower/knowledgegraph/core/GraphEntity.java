package com.purchasingpower.knowledgegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical, deduplicated entity node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphEntity {

    private String entityId;
    private String canonicalName;
    private String entityType;

    @Builder.Default
    private List<String> surfaceForms = new ArrayList<>();

    private int mentionCount;
    private double confidence;
    private double qualityConfidence;
    private QualityTier qualityTier;

    @Builder.Default
    private List<String> mentionRefs = new ArrayList<>();

    @Builder.Default
    private List<String> sourceRefs = new ArrayList<>();

    private Instant createdAt;

    /** Written only by the importance ranker. */
    private double pageRankScore;
}
