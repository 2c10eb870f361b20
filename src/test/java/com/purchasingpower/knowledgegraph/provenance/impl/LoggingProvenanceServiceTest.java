package com.purchasingpower.knowledgegraph.provenance.impl;

import com.purchasingpower.knowledgegraph.provenance.ProvenanceService;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingProvenanceServiceTest {

    private final LoggingProvenanceService provenanceService = new LoggingProvenanceService();

    @Test
    void startAndComplete_tracksOpenOperations() {
        String first = provenanceService.startOperation(ProvenanceService.ENTITY_BUILDER, "build_entities",
            List.of("doc-1"), Map.of("mention_count", 3));
        String second = provenanceService.startOperation(ProvenanceService.EDGE_BUILDER, "build_edges",
            List.of("doc-1"), Map.of());

        assertThat(first).isNotEqualTo(second);
        assertThat(provenanceService.openOperationCount()).isEqualTo(2);

        provenanceService.completeOperation(first, List.of("e1"), true, Map.of("entities_created", 1), null);
        provenanceService.completeOperation(second, List.of(), false, Map.of(), "Datastore unavailable");

        assertThat(provenanceService.openOperationCount()).isZero();
    }

    @Test
    void complete_unknownOperationIsIgnored() {
        assertThatCode(() -> provenanceService.completeOperation("missing", List.of(), true, Map.of(), null))
            .doesNotThrowAnyException();
    }
}
