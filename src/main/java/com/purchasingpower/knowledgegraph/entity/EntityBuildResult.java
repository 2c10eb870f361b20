package com.purchasingpower.knowledgegraph.entity;

import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.OperationError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityBuildResult {

    private boolean success;
    private String operationId;

    @Builder.Default
    private List<GraphEntity> entities = new ArrayList<>();

    /** Created entity count per entity type. */
    @Builder.Default
    private Map<String, Integer> entitiesByType = new LinkedHashMap<>();

    /** Mention id to the entity id it was merged into. */
    @Builder.Default
    private Map<String, String> entityIdMapping = new LinkedHashMap<>();

    private int totalMentions;
    private int skippedGroups;
    private int unlinkedMentions;
    private long durationMs;

    private OperationError error;

    public int getEntitiesCreated() {
        return entities.size();
    }

    public static EntityBuildResult empty(String operationId) {
        return EntityBuildResult.builder()
            .success(true)
            .operationId(operationId)
            .build();
    }

    public static EntityBuildResult failure(String operationId, int totalMentions, OperationError error, long durationMs) {
        return EntityBuildResult.builder()
            .success(false)
            .operationId(operationId)
            .totalMentions(totalMentions)
            .error(error)
            .durationMs(durationMs)
            .build();
    }
}
