package com.purchasingpower.knowledgegraph.edge.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceAssessment;
import com.purchasingpower.knowledgegraph.confidence.ConfidenceFactor;
import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.configuration.EdgeProperties;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.RelationshipCandidate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Edge weight and edge quality heuristics.
 */
@Component
public class EdgeWeightCalculator {

    private static final Set<String> CONNECTING_WORDS =
        Set.of("and", "with", "of", "in", "at", "for", "by", "owns", "works", "leads");

    private final ConfidenceModel confidenceModel;
    private final EdgeProperties properties;

    public EdgeWeightCalculator(ConfidenceModel confidenceModel, KnowledgeGraphProperties properties) {
        this.confidenceModel = confidenceModel;
        this.properties = properties.getEdges();
    }

    /**
     * Equal-weight blend of scaled relationship confidence, extraction-method reliability,
     * pattern confidence (when present) and the proximity penalty (when a distance is
     * present), clamped to {@code [min-weight, max-weight]} and rounded to three decimals.
     */
    public double calculateWeight(RelationshipCandidate candidate) {
        Map<String, ConfidenceFactor> factors = new LinkedHashMap<>();
        double confidence = candidate.getConfidence() != null ? candidate.getConfidence() : 0.0;
        factors.put("relationship_confidence",
            ConfidenceFactor.of(ConfidenceModel.clamp(confidence) * properties.getConfidenceWeightFactor()));
        factors.put("extraction_method", ConfidenceFactor.of(methodConfidence(candidate.getExtractionMethod())));

        Double pattern = candidate.getPatternConfidence();
        if (pattern != null && !pattern.isNaN()) {
            factors.put("pattern_confidence", ConfidenceFactor.of(pattern));
        }
        Integer distance = candidate.getEntityDistance();
        if (distance != null) {
            factors.put("distance", ConfidenceFactor.of(distanceFactor(distance)));
        }

        double weight = confidenceModel.blend(factors);
        weight = Math.max(properties.getMinWeight(), Math.min(properties.getMaxWeight(), weight));
        return Math.round(weight * 1000.0) / 1000.0;
    }

    public ConfidenceAssessment assessQuality(RelationshipCandidate candidate, double weight, String evidenceText) {
        Double pattern = candidate.getPatternConfidence();
        double extractionConfidence = pattern != null && !pattern.isNaN()
            ? pattern
            : properties.getDefaultExtractionConfidence();

        Map<String, ConfidenceFactor> factors = new LinkedHashMap<>();
        factors.put("extraction_confidence", ConfidenceFactor.of(extractionConfidence));
        factors.put("weight_strength", ConfidenceFactor.of(weight));
        factors.put("evidence_quality", ConfidenceFactor.of(evidenceQuality(evidenceText)));

        double confidence = candidate.getConfidence() != null ? candidate.getConfidence() : 0.0;
        return confidenceModel.combine(confidence, factors);
    }

    double methodConfidence(String extractionMethod) {
        if (extractionMethod == null) {
            return properties.getDefaultMethodConfidence();
        }
        return properties.getMethodConfidence().getOrDefault(
            extractionMethod.trim().toLowerCase(Locale.ROOT), properties.getDefaultMethodConfidence());
    }

    double distanceFactor(int entityDistance) {
        double penalty = Math.max(0, entityDistance) / properties.getDistanceScale();
        return Math.max(properties.getMinDistanceFactor(), 1.0 - penalty);
    }

    /**
     * Longer, word-rich evidence that contains a connecting word scores higher.
     */
    double evidenceQuality(String evidenceText) {
        if (evidenceText == null || evidenceText.isBlank()) {
            return 0.3;
        }
        String text = evidenceText.trim();
        double score = 0.5;
        if (text.length() > 50) {
            score += 0.2;
        } else if (text.length() > 20) {
            score += 0.1;
        }

        String[] words = text.toLowerCase(Locale.ROOT).split("\\s+");
        if (words.length >= 5) {
            score += 0.1;
        }
        for (String word : words) {
            if (CONNECTING_WORDS.contains(word.replaceAll("[^a-z]", ""))) {
                score += 0.1;
                break;
            }
        }
        return Math.min(1.0, score);
    }
}
