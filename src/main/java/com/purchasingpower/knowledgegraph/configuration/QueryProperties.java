package com.purchasingpower.knowledgegraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class QueryProperties {

    @Min(0)
    private int defaultMaxHops = 2;

    /** Hard ceiling on caller-supplied hop counts. */
    @Min(0)
    private int maxHopsLimit = 3;

    @Positive
    private int defaultResultLimit = 20;

    @Positive
    private int maxResultLimit = 100;

    /** Seeds kept after fuzzy name resolution. */
    @Positive
    private int maxSeeds = 5;

    /** Parsed terms looked up per query before seed resolution gives up. */
    @Positive
    private int maxSeedTerms = 10;

    /** Candidate entities looked up per search term. */
    @Positive
    private int candidatesPerTerm = 5;

    /** Upper bound on entities reached during expansion, across all seeds. */
    @Positive
    private int maxVisitedEntities = 500;

    /** Multiplier applied once per hop beyond the first. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double hopDecay = 0.85;

    private double pageRankBoostFactor = 2.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double pageRankBoostCap = 0.2;
}
