package com.purchasingpower.knowledgegraph.entity.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceAssessment;
import com.purchasingpower.knowledgegraph.confidence.ConfidenceFactor;
import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.configuration.EntityProperties;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.Mention;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate and quality confidence for a resolved entity.
 */
@Component
public class EntityConfidenceCalculator {

    private final ConfidenceModel confidenceModel;
    private final EntityProperties properties;

    public EntityConfidenceCalculator(ConfidenceModel confidenceModel, KnowledgeGraphProperties properties) {
        this.confidenceModel = confidenceModel;
        this.properties = properties.getEntities();
    }

    /**
     * Blend of mean mention confidence, type reliability, a mention-count boost and a
     * surface-form diversity boost. Boosts saturate at 1.0; the result never drops below the
     * configured floor.
     */
    public double aggregateConfidence(List<Mention> mentions, String entityType, int surfaceFormCount) {
        int mentionCount = mentions.size();
        double mentionCountFactor = Math.min(1.0,
            properties.getMentionCountBase() + properties.getMentionCountStep() * mentionCount);
        double diversityFactor = Math.min(1.0,
            properties.getDiversityBase() + properties.getDiversityStep() * surfaceFormCount);

        Map<String, ConfidenceFactor> factors = new LinkedHashMap<>();
        factors.put("mention_confidence", ConfidenceFactor.of(meanMentionConfidence(mentions), properties.getMentionConfidenceWeight()));
        factors.put("type_confidence", ConfidenceFactor.of(typeConfidence(entityType), properties.getTypeConfidenceWeight()));
        factors.put("mention_count", ConfidenceFactor.of(mentionCountFactor, properties.getMentionCountWeight()));
        factors.put("surface_form_diversity", ConfidenceFactor.of(diversityFactor, properties.getDiversityWeight()));

        return Math.max(properties.getMinConfidence(), confidenceModel.blend(factors));
    }

    public ConfidenceAssessment assessQuality(double confidence, int mentionCount, String canonicalName, String entityType) {
        int nameLength = canonicalName != null ? canonicalName.length() : 0;
        Map<String, ConfidenceFactor> factors = new LinkedHashMap<>();
        factors.put("mention_count", ConfidenceFactor.of(
            Math.min(1.0, (double) mentionCount / properties.getQualityMentionSaturation())));
        factors.put("name_length", ConfidenceFactor.of(
            Math.min(1.0, (double) nameLength / properties.getQualityNameLengthSaturation())));
        factors.put("entity_type_confidence", ConfidenceFactor.of(typeConfidence(entityType)));
        return confidenceModel.combine(confidence, factors);
    }

    double meanMentionConfidence(List<Mention> mentions) {
        if (mentions.isEmpty()) {
            return properties.getDefaultMentionConfidence();
        }
        double sum = 0.0;
        for (Mention mention : mentions) {
            Double confidence = mention.getConfidence();
            sum += confidence == null || confidence.isNaN()
                ? properties.getDefaultMentionConfidence()
                : ConfidenceModel.clamp(confidence);
        }
        return sum / mentions.size();
    }

    double typeConfidence(String entityType) {
        if (entityType == null) {
            return properties.getDefaultTypeConfidence();
        }
        return properties.getTypeConfidence().getOrDefault(entityType, properties.getDefaultTypeConfidence());
    }
}
