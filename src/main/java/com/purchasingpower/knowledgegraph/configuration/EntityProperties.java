package com.purchasingpower.knowledgegraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights used when aggregating mention confidences into an entity confidence.
 */
@Data
public class EntityProperties {

    private double mentionConfidenceWeight = 0.4;
    private double typeConfidenceWeight = 0.25;
    private double mentionCountWeight = 0.2;
    private double diversityWeight = 0.15;

    /** Mention-count factor starts here and grows by {@link #mentionCountStep} per mention, capped at 1.0. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double mentionCountBase = 0.7;
    private double mentionCountStep = 0.1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double diversityBase = 0.8;
    private double diversityStep = 0.05;

    /** Confidence assumed for a mention that carries none. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultMentionConfidence = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultTypeConfidence = 0.75;

    /** Mentions needed for the quality "mention_count" factor to saturate. */
    @Positive
    private int qualityMentionSaturation = 5;

    /** Name length needed for the quality "name_length" factor to saturate. */
    @Positive
    private int qualityNameLengthSaturation = 20;

    private Map<String, Double> typeConfidence = defaultTypeConfidences();

    private static Map<String, Double> defaultTypeConfidences() {
        Map<String, Double> table = new LinkedHashMap<>();
        table.put("PERSON", 0.9);
        table.put("ORG", 0.85);
        table.put("GPE", 0.9);
        table.put("PRODUCT", 0.7);
        table.put("EVENT", 0.75);
        table.put("WORK_OF_ART", 0.7);
        table.put("LAW", 0.85);
        table.put("LANGUAGE", 0.9);
        table.put("FACILITY", 0.8);
        table.put("MONEY", 0.95);
        table.put("DATE", 0.8);
        table.put("TIME", 0.8);
        return table;
    }
}
