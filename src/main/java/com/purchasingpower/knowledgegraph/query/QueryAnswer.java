package com.purchasingpower.knowledgegraph.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryAnswer {

    private String answer;
    private String answerEntityId;
    private String entityType;
    private double confidence;
    private String explanation;

    /** Canonical names from the seed to the answer. */
    @Builder.Default
    private List<String> path = new ArrayList<>();

    @Builder.Default
    private List<String> relationshipPath = new ArrayList<>();

    private int hopCount;
}
