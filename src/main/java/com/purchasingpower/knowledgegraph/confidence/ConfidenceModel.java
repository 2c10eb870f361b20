package com.purchasingpower.knowledgegraph.confidence;

import com.purchasingpower.knowledgegraph.configuration.ConfidenceProperties;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.QualityTier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines confidence signals into a single score and quality tier.
 *
 * <p>Stateless. Tier thresholds come from {@code app.confidence} and are the same for every
 * caller, so an entity tier and an edge tier can be compared directly.
 */
@Component
public class ConfidenceModel {

    private final ConfidenceProperties properties;

    public ConfidenceModel(KnowledgeGraphProperties properties) {
        this.properties = properties.getConfidence();
    }

    /**
     * Average {@code base} with the weighted mean of {@code factors}, clamped to [0,1].
     * Without factors the clamped base is returned unchanged.
     */
    public ConfidenceAssessment combine(double base, Map<String, ConfidenceFactor> factors) {
        if (Double.isNaN(base)) {
            throw new IllegalArgumentException("Base confidence must be a number");
        }
        double clampedBase = clamp(base);
        Map<String, ConfidenceFactor> safeFactors = factors != null ? factors : Collections.emptyMap();

        double confidence = clampedBase;
        if (totalWeight(safeFactors) > 0.0) {
            confidence = clamp((clampedBase + blend(safeFactors)) / 2.0);
        }

        Map<String, Double> contributed = new LinkedHashMap<>();
        safeFactors.forEach((name, factor) -> contributed.put(name, clamp(factor.value())));

        return ConfidenceAssessment.builder()
            .confidence(confidence)
            .tier(tierOf(confidence))
            .factors(Collections.unmodifiableMap(contributed))
            .build();
    }

    /**
     * Weighted mean of the factor values with weights normalized to sum to 1.
     * Returns 0 when no factor carries weight.
     */
    public double blend(Map<String, ConfidenceFactor> factors) {
        double totalWeight = totalWeight(factors);
        if (totalWeight <= 0.0) {
            return 0.0;
        }
        double weighted = 0.0;
        for (ConfidenceFactor factor : factors.values()) {
            weighted += clamp(factor.value()) * (factor.weight() / totalWeight);
        }
        return clamp(weighted);
    }

    public QualityTier tierOf(double confidence) {
        if (confidence >= properties.getHighThreshold()) {
            return QualityTier.HIGH;
        }
        if (confidence >= properties.getMediumThreshold()) {
            return QualityTier.MEDIUM;
        }
        return QualityTier.LOW;
    }

    /**
     * Confidence of a result derived from {@code inputs} by one step governed by {@code rule}.
     * Multiple inputs are combined with the harmonic mean, which is dominated by the weakest.
     */
    public double propagate(List<Double> inputs, PropagationRule rule) {
        if (inputs == null || inputs.isEmpty()) {
            return 0.5;
        }
        double base;
        if (inputs.size() == 1) {
            base = clamp(inputs.get(0));
        } else {
            double reciprocalSum = 0.0;
            for (Double input : inputs) {
                double value = clamp(input != null ? input : 0.0);
                if (value <= 0.0) {
                    // a zero input drives the harmonic mean to zero
                    return rule.getMinConfidence();
                }
                reciprocalSum += 1.0 / value;
            }
            base = inputs.size() / reciprocalSum;
        }
        return clamp(Math.max(base * rule.getDegradationFactor(), rule.getMinConfidence()));
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double totalWeight(Map<String, ConfidenceFactor> factors) {
        double total = 0.0;
        for (ConfidenceFactor factor : factors.values()) {
            total += factor.weight();
        }
        return total;
    }
}
