package com.purchasingpower.knowledgegraph.entity.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.ErrorKind;
import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.Mention;
import com.purchasingpower.knowledgegraph.entity.EntityBuildResult;
import com.purchasingpower.knowledgegraph.entity.EntityIdentity;
import com.purchasingpower.knowledgegraph.entity.IdentityService;
import com.purchasingpower.knowledgegraph.knowledge.InMemoryGraphStore;
import com.purchasingpower.knowledgegraph.provenance.impl.LoggingProvenanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EntityBuilderServiceImplTest {

    private InMemoryGraphStore graphStore;
    private EntityConfidenceCalculator calculator;
    private EntityBuilderServiceImpl service;

    @BeforeEach
    void setUp() {
        KnowledgeGraphProperties properties = new KnowledgeGraphProperties();
        graphStore = new InMemoryGraphStore();
        calculator = new EntityConfidenceCalculator(new ConfidenceModel(properties), properties);
        service = new EntityBuilderServiceImpl(graphStore, new MentionIdentityService(), calculator,
            new LoggingProvenanceService());
    }

    @Test
    @DisplayName("One entity per distinct entity id, with aggregated attributes")
    void buildEntities_groupsMentionsByEntityId() {
        // Given
        List<Mention> mentions = List.of(
            mention("m1", "person-chen", "Dr. Chen", "PERSON", 0.9, "doc-1"),
            mention("m2", "org-stanford", "Stanford", "ORG", 0.8, "doc-1"),
            mention("m3", "person-chen", "Chen", "PERSON", 0.8, "doc-2"),
            mention("m4", "person-chen", "Chen", "PERSON", 0.7, "doc-2"));

        // When
        EntityBuildResult result = service.buildEntities(mentions, List.of("doc-1", "doc-2"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntitiesCreated()).isEqualTo(2);
        assertThat(result.getEntitiesByType()).containsEntry("PERSON", 1).containsEntry("ORG", 1);
        assertThat(result.getEntityIdMapping())
            .containsEntry("m1", "person-chen")
            .containsEntry("m2", "org-stanford")
            .containsEntry("m4", "person-chen");

        GraphEntity chen = graphStore.getEntity("person-chen").orElseThrow();
        assertThat(chen.getCanonicalName()).isEqualTo("Dr. Chen");
        assertThat(chen.getSurfaceForms()).containsExactly("Dr. Chen", "Chen");
        assertThat(chen.getMentionCount()).isEqualTo(3);
        assertThat(chen.getMentionRefs()).containsExactly("m1", "m3", "m4");
        assertThat(chen.getSourceRefs()).containsExactly("doc-1", "doc-2");
        assertThat(chen.getQualityTier()).isNotNull();
    }

    @Test
    void buildEntities_isIdempotentForSameMentions() {
        List<Mention> mentions = List.of(
            mention("m1", "org-mit", "MIT", "ORG", 0.9, "doc-1"),
            mention("m2", "org-mit", "Massachusetts Institute of Technology", "ORG", 0.85, "doc-1"));

        EntityBuildResult first = service.buildEntities(mentions, List.of("doc-1"));
        EntityBuildResult second = service.buildEntities(mentions, List.of("doc-1"));

        assertThat(first.getEntitiesCreated()).isEqualTo(1);
        assertThat(second.getEntitiesCreated()).isEqualTo(1);
        assertThat(graphStore.entityCount()).isEqualTo(1);
        assertThat(graphStore.getEntity("org-mit").orElseThrow().getConfidence())
            .isEqualTo(first.getEntities().get(0).getConfidence());
    }

    @Test
    @DisplayName("Aggregate confidence blends mention mean, type, count and diversity")
    void buildEntities_computesAggregateConfidence() {
        List<Mention> mentions = List.of(
            mention("m1", "p1", "Dr. Chen", "PERSON", 0.9, "doc-1"),
            mention("m2", "p1", "Chen", "PERSON", 0.8, "doc-1"));

        EntityBuildResult result = service.buildEntities(mentions, List.of());

        // 0.4 * 0.85 + 0.25 * 0.9 + 0.2 * 0.9 + 0.15 * 0.9
        double confidence = result.getEntities().get(0).getConfidence();
        assertThat(confidence).isCloseTo(0.88, within(1e-9));
        assertThat(confidence).isNotEqualTo(0.85);
    }

    @Test
    void buildEntities_confidenceGrowsWithMentionCountButStaysCapped() {
        EntityBuildResult single = service.buildEntities(
            List.of(mention("m1", "e1", "Acme", "ORG", 1.0, "d")), List.of());
        EntityBuildResult many = service.buildEntities(List.of(
            mention("m1", "e2", "Acme", "ORG", 1.0, "d"),
            mention("m2", "e2", "Acme", "ORG", 1.0, "d"),
            mention("m3", "e2", "Acme", "ORG", 1.0, "d"),
            mention("m4", "e2", "Acme", "ORG", 1.0, "d"),
            mention("m5", "e2", "Acme", "ORG", 1.0, "d")), List.of());

        double one = single.getEntities().get(0).getConfidence();
        double five = many.getEntities().get(0).getConfidence();
        assertThat(five).isGreaterThan(one);
        assertThat(five).isLessThanOrEqualTo(1.0);
    }

    @Test
    void buildEntities_skipsUnresolvableGroupsAndContinues() {
        IdentityService rejectingOne = (entityId, mentions) -> "ghost".equals(entityId)
            ? Optional.empty()
            : Optional.of(new EntityIdentity(mentions.get(0).getSurfaceForm(), mentions.get(0).getEntityType()));
        service = new EntityBuilderServiceImpl(graphStore, rejectingOne, calculator, new LoggingProvenanceService());

        EntityBuildResult result = service.buildEntities(List.of(
            mention("m1", "ghost", "Ghost", "PERSON", 0.9, "d"),
            mention("m2", "real", "Real", "ORG", 0.9, "d"),
            mention("m3", null, "Nobody", "PERSON", 0.9, "d")), List.of("d"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntitiesCreated()).isEqualTo(1);
        assertThat(result.getSkippedGroups()).isEqualTo(1);
        assertThat(result.getUnlinkedMentions()).isEqualTo(1);
        assertThat(graphStore.getEntity("ghost")).isEmpty();
        assertThat(result.getEntityIdMapping()).containsOnlyKeys("m2");
    }

    @Test
    void buildEntities_emptyBatchIsSuccessfulNoOp() {
        graphStore.setAvailable(false);

        EntityBuildResult result = service.buildEntities(List.of(), List.of("doc-1"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntitiesCreated()).isZero();
        assertThat(result.getError()).isNull();
    }

    @Test
    void buildEntities_failsFastWhenStoreUnavailable() {
        graphStore.setAvailable(false);

        EntityBuildResult result = service.buildEntities(
            List.of(mention("m1", "e1", "Acme", "ORG", 0.9, "d")), List.of("d"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.DATASTORE_UNAVAILABLE);
        assertThat(result.getEntities()).isEmpty();
        graphStore.setAvailable(true);
        assertThat(graphStore.entityCount()).isZero();
    }

    @Test
    void buildEntities_usesDefaultConfidenceForMissingMentionConfidence() {
        EntityBuildResult result = service.buildEntities(
            List.of(mention("m1", "e1", "Acme", "UNLISTED", null, "d")), List.of());

        // 0.4 * 0.5 + 0.25 * 0.75 + 0.2 * 0.8 + 0.15 * 0.85
        assertThat(result.getEntities().get(0).getConfidence()).isCloseTo(0.675, within(1e-9));
    }

    private static Mention mention(String id, String entityId, String form, String type, Double confidence,
                                   String sourceRef) {
        return Mention.builder()
            .mentionId(id)
            .entityId(entityId)
            .surfaceForm(form)
            .entityType(type)
            .confidence(confidence)
            .sourceRef(sourceRef)
            .build();
    }
}
