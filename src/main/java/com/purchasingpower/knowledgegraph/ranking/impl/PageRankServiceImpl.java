package com.purchasingpower.knowledgegraph.ranking.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceAssessment;
import com.purchasingpower.knowledgegraph.confidence.ConfidenceFactor;
import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.confidence.PropagationRule;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.configuration.RankingProperties;
import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.OperationError;
import com.purchasingpower.knowledgegraph.core.RankedEntity;
import com.purchasingpower.knowledgegraph.exception.GraphStoreException;
import com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.knowledgegraph.knowledge.GraphSnapshot;
import com.purchasingpower.knowledgegraph.knowledge.GraphStore;
import com.purchasingpower.knowledgegraph.knowledge.RankScope;
import com.purchasingpower.knowledgegraph.provenance.ProvenanceService;
import com.purchasingpower.knowledgegraph.ranking.PageRankService;
import com.purchasingpower.knowledgegraph.ranking.RankingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class PageRankServiceImpl implements PageRankService {

    private final GraphStore graphStore;
    private final ConfidenceModel confidenceModel;
    private final ProvenanceService provenanceService;
    private final RankingProperties properties;

    public PageRankServiceImpl(GraphStore graphStore, ConfidenceModel confidenceModel,
                               ProvenanceService provenanceService, KnowledgeGraphProperties properties) {
        this.graphStore = graphStore;
        this.confidenceModel = confidenceModel;
        this.provenanceService = provenanceService;
        this.properties = properties.getRanking();
    }

    @Override
    public RankingResult calculatePageRank(RankScope scope) {
        long startTime = System.currentTimeMillis();
        RankScope effective = scope != null ? scope : RankScope.wholeGraph();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("damping_factor", properties.getDampingFactor());
        params.put("max_iterations", properties.getMaxIterations());
        params.put("entity_type", effective.getEntityType());
        params.put("min_confidence", effective.getMinConfidence());
        List<String> inputs = effective.getEntityIds() != null ? new ArrayList<>(effective.getEntityIds()) : List.of();
        String operationId = provenanceService.startOperation(ProvenanceService.PAGERANK, "calculate_pagerank",
            inputs, params);

        GraphSnapshot snapshot;
        try {
            snapshot = graphStore.loadGraph(effective);
        } catch (GraphStoreUnavailableException e) {
            return fail(operationId, OperationError.unavailable(e.getMessage()), startTime);
        } catch (GraphStoreException e) {
            return fail(operationId, OperationError.internal(e.getMessage()), startTime);
        }

        log.info("PageRank [{}]: {} nodes, {} edges ({})", operationId, snapshot.nodeCount(), snapshot.edgeCount(),
            effective.isWholeGraph() ? "whole graph" : "scoped");

        if (snapshot.nodeCount() == 0) {
            provenanceService.completeOperation(operationId, List.of(), true, Map.of("node_count", 0), null);
            return RankingResult.builder()
                .success(true)
                .operationId(operationId)
                .converged(true)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        }

        List<String> nodeIds = snapshot.entities().stream()
            .map(GraphEntity::getEntityId)
            .sorted()
            .toList();
        PageRankCalculator calculator = new PageRankCalculator(properties.getDampingFactor(),
            properties.getMaxIterations(), properties.getTolerance(), properties.getMinEdgeWeight());
        PageRankCalculator.Computation computation = calculator.compute(nodeIds, snapshot.edges());

        if (!computation.converged() && !computation.interrupted()) {
            log.warn("PageRank [{}] did not converge within {} iterations", operationId, computation.iterations());
        }

        List<RankedEntity> ranked = rank(snapshot, computation.scores());

        if (computation.interrupted()) {
            log.warn("PageRank [{}] interrupted after {} iterations, scores not stored", operationId,
                computation.iterations());
            provenanceService.completeOperation(operationId, List.of(), false,
                Map.of("iterations", computation.iterations()), "Interrupted");
            return RankingResult.builder()
                .success(true)
                .operationId(operationId)
                .rankedEntities(ranked)
                .nodeCount(snapshot.nodeCount())
                .edgeCount(snapshot.edgeCount())
                .iterations(computation.iterations())
                .cancelled(true)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        }

        try {
            graphStore.storeRankScores(ranked);
        } catch (GraphStoreUnavailableException e) {
            return fail(operationId, OperationError.unavailable(e.getMessage()), startTime);
        } catch (GraphStoreException e) {
            return fail(operationId, OperationError.internal(e.getMessage()), startTime);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("PageRank [{}] complete: {} entities ranked in {} iterations, converged={} ({}ms)",
            operationId, ranked.size(), computation.iterations(), computation.converged(), duration);

        provenanceService.completeOperation(operationId,
            ranked.stream().limit(properties.getTopEntitiesLimit()).map(RankedEntity::getEntityId).toList(), true,
            Map.of("node_count", snapshot.nodeCount(), "edge_count", snapshot.edgeCount(),
                "iterations", computation.iterations(), "converged", computation.converged()),
            null);

        return RankingResult.builder()
            .success(true)
            .operationId(operationId)
            .rankedEntities(ranked)
            .nodeCount(snapshot.nodeCount())
            .edgeCount(snapshot.edgeCount())
            .iterations(computation.iterations())
            .converged(computation.converged())
            .durationMs(duration)
            .build();
    }

    @Override
    public List<RankedEntity> getTopEntities(int limit, String entityType, Double minScore) {
        int effectiveLimit = limit > 0 ? limit : properties.getTopEntitiesLimit();
        return graphStore.findTopRankedEntities(effectiveLimit, entityType, minScore);
    }

    private List<RankedEntity> rank(GraphSnapshot snapshot, Map<String, Double> scores) {
        Map<String, GraphEntity> byId = new HashMap<>();
        snapshot.entities().forEach(entity -> byId.put(entity.getEntityId(), entity));

        List<Map.Entry<String, Double>> ordered = new ArrayList<>(scores.entrySet());
        ordered.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

        int n = ordered.size();
        double connectivity = Math.min(1.0, (double) snapshot.edgeCount() / n);
        Instant calculatedAt = Instant.now();

        List<RankedEntity> ranked = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map.Entry<String, Double> entry = ordered.get(i);
            GraphEntity entity = byId.get(entry.getKey());
            double score = entry.getValue();

            double base = confidenceModel.propagate(List.of(entity.getConfidence()), PropagationRule.GRAPH_ANALYSIS);
            Map<String, ConfidenceFactor> factors = new LinkedHashMap<>();
            factors.put("score_magnitude", ConfidenceFactor.of(Math.min(1.0, score * 10.0)));
            factors.put("graph_connectivity", ConfidenceFactor.of(connectivity));
            ConfidenceAssessment quality = confidenceModel.combine(base, factors);

            ranked.add(RankedEntity.builder()
                .entityId(entity.getEntityId())
                .canonicalName(entity.getCanonicalName())
                .entityType(entity.getEntityType())
                .score(score)
                .rank(i + 1)
                .percentile((double) (n - i) / n * 100.0)
                .entityConfidence(entity.getConfidence())
                .qualityConfidence(quality.getConfidence())
                .qualityTier(quality.getTier())
                .calculatedAt(calculatedAt)
                .build());
        }
        return ranked;
    }

    private RankingResult fail(String operationId, OperationError error, long startTime) {
        log.error("PageRank [{}] failed: {}", operationId, error.getMessage());
        provenanceService.completeOperation(operationId, List.of(), false, Map.of("error_kind", error.getKind()),
            error.getMessage());
        return RankingResult.failure(operationId, error, System.currentTimeMillis() - startTime);
    }
}
