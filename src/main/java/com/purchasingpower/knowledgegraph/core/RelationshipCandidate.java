package com.purchasingpower.knowledgegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relationship record produced by the upstream relation extractor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipCandidate {

    /** Optional; generated when absent. */
    private String relationshipId;
    private String subjectEntityId;
    private String objectEntityId;
    private String relationshipType;
    private Double confidence;
    private String evidenceText;
    private String extractionMethod;
    private Double patternConfidence;
    private Integer entityDistance;
}
