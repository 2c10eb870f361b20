package com.purchasingpower.knowledgegraph.api;

import com.purchasingpower.knowledgegraph.core.RelationshipCandidate;
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
public class EdgeBuildRequest {

    @Builder.Default
    private List<RelationshipCandidate> relationships = new ArrayList<>();

    @Builder.Default
    private List<String> sourceRefs = new ArrayList<>();

    private boolean verifyEntities;
}
