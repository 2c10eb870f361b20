package com.purchasingpower.knowledgegraph.knowledge;

import com.purchasingpower.knowledgegraph.core.GraphEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One edge crossed while expanding from {@code fromEntityId} to {@code neighbor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NeighborHop {

    private String fromEntityId;
    private String relationshipType;
    private double weight;
    private GraphEntity neighbor;
}
