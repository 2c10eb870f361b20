package com.purchasingpower.knowledgegraph.integration;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.Mention;
import com.purchasingpower.knowledgegraph.core.RankedEntity;
import com.purchasingpower.knowledgegraph.core.RelationshipCandidate;
import com.purchasingpower.knowledgegraph.edge.EdgeBuildResult;
import com.purchasingpower.knowledgegraph.edge.impl.EdgeBuilderServiceImpl;
import com.purchasingpower.knowledgegraph.edge.impl.EdgeWeightCalculator;
import com.purchasingpower.knowledgegraph.entity.EntityBuildResult;
import com.purchasingpower.knowledgegraph.entity.impl.EntityBuilderServiceImpl;
import com.purchasingpower.knowledgegraph.entity.impl.EntityConfidenceCalculator;
import com.purchasingpower.knowledgegraph.entity.impl.MentionIdentityService;
import com.purchasingpower.knowledgegraph.knowledge.InMemoryGraphStore;
import com.purchasingpower.knowledgegraph.knowledge.RankScope;
import com.purchasingpower.knowledgegraph.provenance.impl.LoggingProvenanceService;
import com.purchasingpower.knowledgegraph.query.QueryAnswer;
import com.purchasingpower.knowledgegraph.query.QueryRequest;
import com.purchasingpower.knowledgegraph.query.QueryResponse;
import com.purchasingpower.knowledgegraph.query.impl.MultiHopQueryServiceImpl;
import com.purchasingpower.knowledgegraph.query.impl.QueryParser;
import com.purchasingpower.knowledgegraph.ranking.RankingResult;
import com.purchasingpower.knowledgegraph.ranking.impl.PageRankServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs mentions through entity building, edge building, ranking and querying against one store.
 */
class EndToEndPipelineTest {

    private InMemoryGraphStore graphStore;
    private EntityBuilderServiceImpl entityBuilder;
    private EdgeBuilderServiceImpl edgeBuilder;
    private PageRankServiceImpl pageRank;
    private MultiHopQueryServiceImpl queryService;

    @BeforeEach
    void setUp() {
        KnowledgeGraphProperties properties = new KnowledgeGraphProperties();
        ConfidenceModel model = new ConfidenceModel(properties);
        LoggingProvenanceService provenance = new LoggingProvenanceService();
        graphStore = new InMemoryGraphStore();

        entityBuilder = new EntityBuilderServiceImpl(graphStore, new MentionIdentityService(),
            new EntityConfidenceCalculator(model, properties), provenance);
        edgeBuilder = new EdgeBuilderServiceImpl(graphStore, new EdgeWeightCalculator(model, properties),
            provenance, properties);
        pageRank = new PageRankServiceImpl(graphStore, model, provenance, properties);
        queryService = new MultiHopQueryServiceImpl(graphStore, new QueryParser(), provenance, properties);
    }

    @Test
    @DisplayName("Mentions become a ranked graph that answers a connection question")
    void pipeline_fromMentionsToAnswers() {
        // Given
        List<Mention> mentions = List.of(
            mention("m1", "chen", "Dr. Chen", "PERSON", 0.92),
            mention("m2", "chen", "Chen", "PERSON", 0.88),
            mention("m3", "stanford", "Stanford", "ORG", 0.95),
            mention("m4", "stanford", "Stanford University", "ORG", 0.9),
            mention("m5", "mit", "MIT", "ORG", 0.9));

        // When
        EntityBuildResult entities = entityBuilder.buildEntities(mentions, List.of("doc-1"));

        // Then
        assertThat(entities.isSuccess()).isTrue();
        assertThat(entities.getEntitiesCreated()).isEqualTo(3);
        assertThat(graphStore.entityCount()).isEqualTo(3);

        // When
        EdgeBuildResult edges = edgeBuilder.buildEdges(List.of(
            candidate("r1", "chen", "AFFILIATED_WITH", "stanford", 0.85),
            candidate("r2", "stanford", "COLLABORATES_WITH", "mit", 0.8)), List.of("doc-1"), true);

        // Then
        assertThat(edges.isSuccess()).isTrue();
        assertThat(edges.getEdgesCreated()).isEqualTo(2);
        assertThat(edges.getEdgesFailed()).isZero();

        // When
        RankingResult ranking = pageRank.calculatePageRank(RankScope.wholeGraph());

        // Then
        assertThat(ranking.isSuccess()).isTrue();
        assertThat(ranking.getNodeCount()).isEqualTo(3);
        assertThat(ranking.getEdgeCount()).isEqualTo(2);
        assertThat(ranking.getRankedEntities()).extracting(RankedEntity::getRank).containsExactly(1, 2, 3);
        assertThat(pageRank.getTopEntities(5, "ORG", null))
            .extracting(RankedEntity::getEntityId)
            .containsExactlyInAnyOrder("stanford", "mit");

        // When
        QueryResponse response = queryService.query(QueryRequest.builder()
            .question("What organizations are connected to Stanford?")
            .maxHops(2)
            .build());

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getResults()).extracting(QueryAnswer::getAnswer)
            .contains("MIT")
            .doesNotContain("Dr. Chen");
        QueryAnswer first = response.getResults().get(0);
        assertThat(first.getAnswerEntityId()).isEqualTo("mit");
        assertThat(first.getRelationshipPath()).containsExactly("COLLABORATES_WITH");
    }

    @Test
    void pipeline_rejectsEdgesToUnknownEntities() {
        // Given
        entityBuilder.buildEntities(List.of(mention("m1", "mit", "MIT", "ORG", 0.9)), List.of());

        // When
        EdgeBuildResult edges = edgeBuilder.buildEdges(List.of(
            candidate("r1", "ghost", "AFFILIATED_WITH", "mit", 0.9)), List.of(), true);

        // Then
        assertThat(edges.isSuccess()).isFalse();
        assertThat(edges.getError().getMissingEntityIds()).containsExactly("ghost");
        assertThat(graphStore.getRelationships()).isEmpty();
    }

    private static Mention mention(String id, String entityId, String form, String type, double confidence) {
        return Mention.builder()
            .mentionId(id)
            .entityId(entityId)
            .surfaceForm(form)
            .entityType(type)
            .confidence(confidence)
            .sourceRef("doc-1")
            .build();
    }

    private static RelationshipCandidate candidate(String id, String subject, String type, String object,
                                                   double confidence) {
        return RelationshipCandidate.builder()
            .relationshipId(id)
            .subjectEntityId(subject)
            .relationshipType(type)
            .objectEntityId(object)
            .confidence(confidence)
            .extractionMethod("pattern_based")
            .build();
    }
}
