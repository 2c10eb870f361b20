package com.purchasingpower.knowledgegraph.query;

import com.purchasingpower.knowledgegraph.core.OperationError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Query outcome. A successful response with no results means no answer was found.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private boolean success;
    private String question;
    private QueryIntent intent;

    /** Last stage reached; the failing stage when {@code success} is false. */
    private QueryStage stage;

    @Builder.Default
    private List<String> seedEntities = new ArrayList<>();

    @Builder.Default
    private List<QueryAnswer> results = new ArrayList<>();

    private int totalResults;
    private QueryStats stats;
    private long durationMs;

    private OperationError error;

    public static QueryResponse failure(String question, QueryStage stage, OperationError error, long durationMs) {
        return QueryResponse.builder()
            .success(false)
            .question(question)
            .stage(stage)
            .error(error)
            .durationMs(durationMs)
            .build();
    }
}
