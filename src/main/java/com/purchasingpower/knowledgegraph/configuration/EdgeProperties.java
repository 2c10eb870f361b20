package com.purchasingpower.knowledgegraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Edge weight bounds and the factors that feed the weight blend.
 */
@Data
public class EdgeProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minWeight = 0.1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxWeight = 1.0;

    /** Scales the relationship confidence before it enters the blend. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceWeightFactor = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultMethodConfidence = 0.5;

    /** Token distance at which the proximity penalty bottoms out. */
    @Positive
    private double distanceScale = 100.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minDistanceFactor = 0.2;

    /** Extraction confidence used in the quality assessment when a candidate has no pattern confidence. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultExtractionConfidence = 0.5;

    @Positive
    private int maxEvidenceLength = 500;

    /**
     * Accept relationships inferred purely from token proximity. When disabled such candidates
     * are skipped and counted as filtered.
     */
    private boolean proximityEdgesEnabled = true;

    /** Edges returned by a relationship search when the caller gives no limit. */
    @Positive
    private int defaultSearchLimit = 100;

    @Positive
    private int maxSearchLimit = 1000;

    private Map<String, Double> methodConfidence = defaultMethodConfidences();

    private static Map<String, Double> defaultMethodConfidences() {
        Map<String, Double> table = new LinkedHashMap<>();
        table.put("pattern_based", 0.8);
        table.put("dependency_parsing", 0.75);
        table.put("proximity_based", 0.4);
        return table;
    }
}
