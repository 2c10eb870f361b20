package com.purchasingpower.knowledgegraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

/**
 * Quality tier boundaries. Shared by every stage so that tiers are comparable across
 * entities, edges, ranks and query answers.
 */
@Data
public class ConfidenceProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double highThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double mediumThreshold = 0.5;
}
