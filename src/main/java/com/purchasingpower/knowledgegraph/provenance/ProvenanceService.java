package com.purchasingpower.knowledgegraph.provenance;

import java.util.List;
import java.util.Map;

/**
 * Records which tool ran, on which inputs, with which parameters and what it produced.
 */
public interface ProvenanceService {

    String ENTITY_BUILDER = "ENTITY_BUILDER";
    String EDGE_BUILDER = "EDGE_BUILDER";
    String PAGERANK = "PAGERANK";
    String MULTIHOP_QUERY = "MULTIHOP_QUERY";

    /**
     * @return Operation id to pass to {@link #completeOperation}
     */
    String startOperation(String toolId, String operationType, List<String> inputs, Map<String, Object> parameters);

    void completeOperation(String operationId, List<String> outputs, boolean success,
                           Map<String, Object> metadata, String errorMessage);
}
