package com.purchasingpower.knowledgegraph.api;

import com.purchasingpower.knowledgegraph.core.Mention;
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
public class EntityBuildRequest {

    @Builder.Default
    private List<Mention> mentions = new ArrayList<>();

    @Builder.Default
    private List<String> sourceRefs = new ArrayList<>();
}
