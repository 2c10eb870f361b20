package com.purchasingpower.knowledgegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Natural-language graph query request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphQueryRequest {

    private String question;
    private Integer maxHops;
    private Integer resultLimit;
    private List<String> queryEntities;
}
