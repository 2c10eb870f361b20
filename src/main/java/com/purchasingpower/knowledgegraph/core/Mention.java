package com.purchasingpower.knowledgegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One surface-form occurrence of an entity in a source unit, as produced by the upstream
 * extractor. The entity id has already been assigned by the linking step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Mention {

    private String mentionId;
    private String entityId;
    private String surfaceForm;
    private String entityType;
    private Double confidence;
    private String sourceRef;
}
