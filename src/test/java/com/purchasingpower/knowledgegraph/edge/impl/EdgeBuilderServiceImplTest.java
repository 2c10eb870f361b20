package com.purchasingpower.knowledgegraph.edge.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.ErrorKind;
import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.RelationshipCandidate;
import com.purchasingpower.knowledgegraph.edge.EdgeBuildResult;
import com.purchasingpower.knowledgegraph.edge.EdgeFailure;
import com.purchasingpower.knowledgegraph.knowledge.InMemoryGraphStore;
import com.purchasingpower.knowledgegraph.provenance.impl.LoggingProvenanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EdgeBuilderServiceImplTest {

    private KnowledgeGraphProperties properties;
    private InMemoryGraphStore graphStore;
    private EdgeBuilderServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new KnowledgeGraphProperties();
        graphStore = new InMemoryGraphStore();
        graphStore.addEntity("chen", "Chen", "PERSON", 0.9);
        graphStore.addEntity("stanford", "Stanford", "ORG", 0.9);
        graphStore.addEntity("mit", "MIT", "ORG", 0.85);
        service = newService();
    }

    private EdgeBuilderServiceImpl newService() {
        EdgeWeightCalculator calculator = new EdgeWeightCalculator(new ConfidenceModel(properties), properties);
        return new EdgeBuilderServiceImpl(graphStore, calculator, new LoggingProvenanceService(), properties);
    }

    @Test
    void buildEdges_createsWeightedEdges() {
        // Given
        List<RelationshipCandidate> candidates = List.of(
            candidate("r1", "chen", "affiliated with", "stanford", 0.85),
            candidate("r2", "stanford", "COLLABORATES_WITH", "mit", 0.8));

        // When
        EdgeBuildResult result = service.buildEdges(candidates, List.of("doc-1"), true);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEdgesCreated()).isEqualTo(2);
        assertThat(result.getFailures()).isEmpty();
        assertThat(result.getRelationshipTypes())
            .containsEntry("AFFILIATED_WITH", 1)
            .containsEntry("COLLABORATES_WITH", 1);
        assertThat(graphStore.getRelationships())
            .extracting(GraphRelationship::getRelationshipType)
            .containsExactly("AFFILIATED_WITH", "COLLABORATES_WITH");
        assertThat(graphStore.getRelationships())
            .allSatisfy(edge -> {
                assertThat(edge.getWeight()).isBetween(0.1, 1.0);
                assertThat(edge.getQualityTier()).isNotNull();
                assertThat(edge.getSourceRefs()).containsExactly("doc-1");
            });
        assertThat(result.getWeightDistribution().high() + result.getWeightDistribution().medium()
            + result.getWeightDistribution().low()).isEqualTo(2);
    }

    @Test
    @DisplayName("Batch verification rejects the whole batch and writes nothing")
    void buildEdges_verificationRejectsBatchWithMissingEndpoints() {
        List<RelationshipCandidate> candidates = List.of(
            candidate("r1", "chen", "AFFILIATED_WITH", "stanford", 0.85),
            candidate("r2", "ghost", "KNOWS", "chen", 0.7),
            candidate("r3", "stanford", "PARTNERS_WITH", "phantom", 0.7));

        EdgeBuildResult result = service.buildEdges(candidates, List.of(), true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.REFERENTIAL_INTEGRITY);
        assertThat(result.getError().getMissingEntityIds()).containsExactly("ghost", "phantom");
        assertThat(result.getEdgesCreated()).isZero();
        assertThat(result.getFailures())
            .extracting(EdgeFailure::relationshipId)
            .containsExactly("r2", "r3");
        assertThat(graphStore.getRelationships()).isEmpty();
        assertThat(graphStore.getWriteCount()).isZero();
        assertThat(graphStore.getExistenceChecks()).isEqualTo(1);
    }

    @Test
    void buildEdges_withoutVerificationReportsMissingEndpointsPerEdge() {
        List<RelationshipCandidate> candidates = List.of(
            candidate("r1", "chen", "AFFILIATED_WITH", "stanford", 0.85),
            candidate("r2", "ghost", "KNOWS", "chen", 0.7));

        EdgeBuildResult result = service.buildEdges(candidates, List.of(), false);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEdgesCreated()).isEqualTo(1);
        assertThat(result.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.relationshipId()).isEqualTo("r2");
            assertThat(failure.missingEntityIds()).containsExactly("ghost");
        });
    }

    @Test
    void buildEdges_failureOnOneEdgeDoesNotAbortBatch() {
        graphStore.failRelationship("r1");

        EdgeBuildResult result = service.buildEdges(List.of(
            candidate("r1", "chen", "AFFILIATED_WITH", "stanford", 0.85),
            candidate("r2", "stanford", "COLLABORATES_WITH", "mit", 0.8)), List.of(), true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEdges()).extracting(GraphRelationship::getRelationshipId).containsExactly("r2");
        assertThat(result.getFailures()).extracting(EdgeFailure::relationshipId).containsExactly("r1");
    }

    @Test
    void buildEdges_skipsMalformedCandidates() {
        List<RelationshipCandidate> candidates = new ArrayList<>();
        candidates.add(candidate("r1", "chen", "AFFILIATED_WITH", "stanford", 0.85));
        candidates.add(candidate("r2", "", "KNOWS", "chen", 0.7));
        candidates.add(candidate("r3", "chen", "KNOWS", "mit", 1.5));
        candidates.add(candidate("r4", "chen", "KNOWS", "mit", Double.NaN));
        candidates.add(null);

        EdgeBuildResult result = service.buildEdges(candidates, List.of(), true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEdgesCreated()).isEqualTo(1);
        assertThat(result.getSkippedInvalid()).isEqualTo(4);
        assertThat(result.getTotalCandidates()).isEqualTo(5);
    }

    @Test
    void buildEdges_filtersProximityEdgesWhenDisabled() {
        properties.getEdges().setProximityEdgesEnabled(false);
        service = newService();

        RelationshipCandidate proximity = candidate("r1", "chen", "RELATED_TO", "mit", 0.5);
        proximity.setExtractionMethod("proximity_based");
        proximity.setEntityDistance(12);

        EdgeBuildResult result = service.buildEdges(List.of(proximity,
            candidate("r2", "chen", "AFFILIATED_WITH", "stanford", 0.85)), List.of(), false);

        assertThat(result.getFiltered()).isEqualTo(1);
        assertThat(result.getEdges()).extracting(GraphRelationship::getRelationshipId).containsExactly("r2");
    }

    @Test
    void buildEdges_generatesIdsAndTruncatesEvidence() {
        RelationshipCandidate candidate = candidate(null, "chen", "AFFILIATED_WITH", "stanford", 0.85);
        candidate.setEvidenceText("x".repeat(800));

        EdgeBuildResult result = service.buildEdges(List.of(candidate), List.of(), false);

        GraphRelationship edge = result.getEdges().get(0);
        assertThat(edge.getRelationshipId()).isNotBlank();
        assertThat(edge.getEvidenceText()).hasSize(500);
    }

    @Test
    void buildEdges_emptyBatchIsSuccessfulNoOp() {
        EdgeBuildResult result = service.buildEdges(List.of(), List.of(), true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEdgesCreated()).isZero();
        assertThat(graphStore.getExistenceChecks()).isZero();
    }

    @Test
    void buildEdges_failsWhenStoreUnavailable() {
        graphStore.setAvailable(false);

        EdgeBuildResult result = service.buildEdges(List.of(
            candidate("r1", "chen", "AFFILIATED_WITH", "stanford", 0.85)), List.of(), true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.DATASTORE_UNAVAILABLE);
    }

    @Test
    void searchRelationships_filtersByTypeAndWeightRange() {
        // Given
        graphStore.addEdge("chen", "AFFILIATED_WITH", "stanford", 0.9);
        graphStore.addEdge("chen", "AFFILIATED_WITH", "mit", 0.4);
        graphStore.addEdge("stanford", "COLLABORATES_WITH", "mit", 0.8);

        // When
        List<GraphRelationship> strong = service.searchRelationships("affiliated with", 0.5, null, 0);
        List<GraphRelationship> all = service.searchRelationships(null, null, null, 0);

        // Then
        assertThat(strong).singleElement().satisfies(edge -> {
            assertThat(edge.getObjectEntityId()).isEqualTo("stanford");
            assertThat(edge.getRelationshipType()).isEqualTo("AFFILIATED_WITH");
        });
        assertThat(all).extracting(GraphRelationship::getWeight).containsExactly(0.9, 0.8, 0.4);
    }

    @Test
    void searchRelationships_capsLimit() {
        properties.getEdges().setMaxSearchLimit(2);
        service = newService();
        graphStore.addEdge("chen", "AFFILIATED_WITH", "stanford", 0.9);
        graphStore.addEdge("chen", "AFFILIATED_WITH", "mit", 0.4);
        graphStore.addEdge("stanford", "COLLABORATES_WITH", "mit", 0.8);

        assertThat(service.searchRelationships(null, null, 0.5, 50)).hasSize(1);
        assertThat(service.searchRelationships(null, null, null, 50)).hasSize(2);
    }

    private static RelationshipCandidate candidate(String id, String subject, String type, String object,
                                                   double confidence) {
        return RelationshipCandidate.builder()
            .relationshipId(id)
            .subjectEntityId(subject)
            .objectEntityId(object)
            .relationshipType(type)
            .confidence(confidence)
            .evidenceText(subject + " " + type + " " + object)
            .extractionMethod("pattern_based")
            .build();
    }
}
