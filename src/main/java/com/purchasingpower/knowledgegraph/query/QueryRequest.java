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
public class QueryRequest {

    private String question;

    /** Null uses the configured default; larger values are capped. */
    private Integer maxHops;

    /** Null uses the configured default; larger values are capped. */
    private Integer resultLimit;

    /** Entity ids to start from instead of names found in the question. */
    @Builder.Default
    private List<String> queryEntities = new ArrayList<>();
}
