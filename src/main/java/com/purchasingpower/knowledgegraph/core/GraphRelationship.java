package com.purchasingpower.knowledgegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Directed, typed, weighted edge between two persisted entities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphRelationship {

    private String relationshipId;
    private String subjectEntityId;
    private String objectEntityId;

    /** Sanitized identifier, safe to use as a relationship label. */
    private String relationshipType;

    private double weight;
    private double confidence;
    private String extractionMethod;
    private String evidenceText;
    private Double patternConfidence;
    private Integer entityDistance;
    private double qualityConfidence;
    private QualityTier qualityTier;

    @Builder.Default
    private List<String> sourceRefs = new ArrayList<>();

    private Instant createdAt;
}
