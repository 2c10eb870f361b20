package com.purchasingpower.knowledgegraph.confidence;

import com.purchasingpower.knowledgegraph.core.QualityTier;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ConfidenceAssessment {

    double confidence;
    QualityTier tier;

    /** Clamped factor values that contributed, keyed by factor name. */
    Map<String, Double> factors;
}
