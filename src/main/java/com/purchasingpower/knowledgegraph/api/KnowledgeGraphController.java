package com.purchasingpower.knowledgegraph.api;

import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.OperationError;
import com.purchasingpower.knowledgegraph.core.RankedEntity;
import com.purchasingpower.knowledgegraph.edge.EdgeBuildResult;
import com.purchasingpower.knowledgegraph.edge.EdgeBuilderService;
import com.purchasingpower.knowledgegraph.entity.EntityBuildResult;
import com.purchasingpower.knowledgegraph.entity.EntityBuilderService;
import com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.knowledgegraph.knowledge.GraphStatistics;
import com.purchasingpower.knowledgegraph.knowledge.GraphStore;
import com.purchasingpower.knowledgegraph.knowledge.RankScope;
import com.purchasingpower.knowledgegraph.query.MultiHopQueryService;
import com.purchasingpower.knowledgegraph.query.QueryRequest;
import com.purchasingpower.knowledgegraph.query.QueryResponse;
import com.purchasingpower.knowledgegraph.query.QueryStage;
import com.purchasingpower.knowledgegraph.ranking.PageRankService;
import com.purchasingpower.knowledgegraph.ranking.RankingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * REST controller for graph construction, ranking and querying.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class KnowledgeGraphController {

    private final EntityBuilderService entityBuilderService;
    private final EdgeBuilderService edgeBuilderService;
    private final PageRankService pageRankService;
    private final MultiHopQueryService queryService;
    private final GraphStore graphStore;

    /**
     * Resolve mentions into entities.
     *
     * POST /api/v1/graph/entities
     */
    @PostMapping("/entities")
    public ResponseEntity<EntityBuildResult> buildEntities(@RequestBody EntityBuildRequest request) {
        try {
            EntityBuildResult result = entityBuilderService.buildEntities(request.getMentions(), request.getSourceRefs());
            return ResponseEntity.status(statusFor(result.getError())).body(result);
        } catch (Exception e) {
            log.error("Entity build failed", e);
            return ResponseEntity.internalServerError()
                .body(EntityBuildResult.failure(null, 0, OperationError.internal(e.getMessage()), 0));
        }
    }

    /**
     * Materialize relationship candidates as edges.
     *
     * POST /api/v1/graph/edges
     */
    @PostMapping("/edges")
    public ResponseEntity<EdgeBuildResult> buildEdges(@RequestBody EdgeBuildRequest request) {
        try {
            EdgeBuildResult result = edgeBuilderService.buildEdges(request.getRelationships(), request.getSourceRefs(),
                request.isVerifyEntities());
            return ResponseEntity.status(statusFor(result.getError())).body(result);
        } catch (Exception e) {
            log.error("Edge build failed", e);
            return ResponseEntity.internalServerError()
                .body(EdgeBuildResult.builder().error(OperationError.internal(e.getMessage())).build());
        }
    }

    /**
     * Stored edges filtered by type and weight range.
     *
     * GET /api/v1/graph/edges?relationship_type=AFFILIATED_WITH&min_weight=0.5&max_weight=1.0&limit=50
     */
    @GetMapping("/edges")
    public ResponseEntity<List<GraphRelationship>> searchEdges(
            @RequestParam(value = "relationship_type", required = false) String relationshipType,
            @RequestParam(value = "min_weight", required = false) Double minWeight,
            @RequestParam(value = "max_weight", required = false) Double maxWeight,
            @RequestParam(value = "limit", defaultValue = "0") int limit) {
        if (minWeight != null && maxWeight != null && minWeight > maxWeight) {
            log.warn("Rejected edge search: min_weight {} > max_weight {}", minWeight, maxWeight);
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.ok(edgeBuilderService.searchRelationships(relationshipType, minWeight, maxWeight, limit));
        } catch (GraphStoreUnavailableException e) {
            log.error("Edge search unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (Exception e) {
            log.error("Edge search failed", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Recompute importance ranks.
     *
     * POST /api/v1/graph/rank
     */
    @PostMapping("/rank")
    public ResponseEntity<RankingResult> rank(@RequestBody(required = false) RankRequest request) {
        try {
            RankScope scope = RankScope.wholeGraph();
            if (request != null) {
                scope = RankScope.builder()
                    .entityIds(request.getEntityIds() != null ? new LinkedHashSet<>(request.getEntityIds()) : null)
                    .entityType(request.getEntityType())
                    .minConfidence(request.getMinConfidence())
                    .build();
            }
            RankingResult result = pageRankService.calculatePageRank(scope);
            return ResponseEntity.status(statusFor(result.getError())).body(result);
        } catch (Exception e) {
            log.error("Ranking failed", e);
            return ResponseEntity.internalServerError()
                .body(RankingResult.failure(null, OperationError.internal(e.getMessage()), 0));
        }
    }

    /**
     * Highest ranked entities.
     *
     * GET /api/v1/graph/rank/top?limit=10&entity_type=ORG&min_score=0.01
     */
    @GetMapping("/rank/top")
    public ResponseEntity<List<RankedEntity>> topEntities(
            @RequestParam(value = "limit", defaultValue = "0") int limit,
            @RequestParam(value = "entity_type", required = false) String entityType,
            @RequestParam(value = "min_score", required = false) Double minScore) {
        try {
            return ResponseEntity.ok(pageRankService.getTopEntities(limit, entityType, minScore));
        } catch (GraphStoreUnavailableException e) {
            log.error("Top entities unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (Exception e) {
            log.error("Failed to get top entities", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Answer a natural-language question.
     *
     * POST /api/v1/graph/query
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@RequestBody GraphQueryRequest request) {
        try {
            QueryRequest query = QueryRequest.builder()
                .question(request.getQuestion())
                .maxHops(request.getMaxHops())
                .resultLimit(request.getResultLimit())
                .queryEntities(request.getQueryEntities() != null ? request.getQueryEntities() : new ArrayList<>())
                .build();
            QueryResponse response = queryService.query(query);
            return ResponseEntity.status(statusFor(response.getError())).body(response);
        } catch (Exception e) {
            log.error("Query failed", e);
            return ResponseEntity.internalServerError()
                .body(QueryResponse.failure(request.getQuestion(), QueryStage.PARSE,
                    OperationError.internal(e.getMessage()), 0));
        }
    }

    /**
     * Graph size and type distributions.
     *
     * GET /api/v1/graph/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<GraphStatistics> statistics() {
        try {
            return ResponseEntity.ok(graphStore.getStatistics());
        } catch (GraphStoreUnavailableException e) {
            log.error("Statistics unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (Exception e) {
            log.error("Failed to get graph statistics", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    static HttpStatus statusFor(OperationError error) {
        if (error == null || error.getKind() == null) {
            return HttpStatus.OK;
        }
        return switch (error.getKind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case REFERENTIAL_INTEGRITY -> HttpStatus.CONFLICT;
            case DATASTORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
