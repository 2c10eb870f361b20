package com.purchasingpower.knowledgegraph.edge;

import java.util.List;

/**
 * One relationship candidate that was not written.
 *
 * @param relationshipId Candidate id (generated when the extractor supplied none)
 * @param subjectEntityId Subject endpoint
 * @param objectEntityId Object endpoint
 * @param missingEntityIds Endpoints absent from the graph, empty for other failures
 * @param reason Short human-readable cause
 */
public record EdgeFailure(String relationshipId, String subjectEntityId, String objectEntityId,
                          List<String> missingEntityIds, String reason) {
}
