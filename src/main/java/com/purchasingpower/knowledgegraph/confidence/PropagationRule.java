package com.purchasingpower.knowledgegraph.confidence;

import lombok.Getter;

/**
 * Confidence lost when a result is derived from inputs by one processing step.
 */
@Getter
public enum PropagationRule {
    TEXT_EXTRACTION(0.95, 0.1),
    NLP_PROCESSING(0.9, 0.1),
    RELATIONSHIP_EXTRACTION(0.85, 0.1),
    ENTITY_LINKING(0.9, 0.1),
    GRAPH_ANALYSIS(0.95, 0.1);

    private final double degradationFactor;
    private final double minConfidence;

    PropagationRule(double degradationFactor, double minConfidence) {
        this.degradationFactor = degradationFactor;
        this.minConfidence = minConfidence;
    }
}
