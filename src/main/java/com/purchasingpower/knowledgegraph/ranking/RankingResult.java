package com.purchasingpower.knowledgegraph.ranking;

import com.purchasingpower.knowledgegraph.core.OperationError;
import com.purchasingpower.knowledgegraph.core.RankedEntity;
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
public class RankingResult {

    private boolean success;
    private String operationId;

    /** Sorted by score descending, ties by entity id. */
    @Builder.Default
    private List<RankedEntity> rankedEntities = new ArrayList<>();

    private int nodeCount;
    private int edgeCount;
    private int iterations;
    private boolean converged;

    /** The run was interrupted; scores are from the last finished iteration and were not stored. */
    private boolean cancelled;

    private long durationMs;

    private OperationError error;

    public static RankingResult failure(String operationId, OperationError error, long durationMs) {
        return RankingResult.builder()
            .success(false)
            .operationId(operationId)
            .error(error)
            .durationMs(durationMs)
            .build();
    }
}
