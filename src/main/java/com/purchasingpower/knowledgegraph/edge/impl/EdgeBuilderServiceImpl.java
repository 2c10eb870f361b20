package com.purchasingpower.knowledgegraph.edge.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceAssessment;
import com.purchasingpower.knowledgegraph.configuration.EdgeProperties;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.GraphRelationship;
import com.purchasingpower.knowledgegraph.core.OperationError;
import com.purchasingpower.knowledgegraph.core.RelationshipCandidate;
import com.purchasingpower.knowledgegraph.edge.EdgeBuildResult;
import com.purchasingpower.knowledgegraph.edge.EdgeBuilderService;
import com.purchasingpower.knowledgegraph.edge.EdgeFailure;
import com.purchasingpower.knowledgegraph.edge.WeightDistribution;
import com.purchasingpower.knowledgegraph.exception.GraphStoreException;
import com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.knowledgegraph.knowledge.GraphStore;
import com.purchasingpower.knowledgegraph.knowledge.RelationshipTypes;
import com.purchasingpower.knowledgegraph.provenance.ProvenanceService;
import com.purchasingpower.knowledgegraph.util.StoreCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

@Slf4j
@Service
public class EdgeBuilderServiceImpl implements EdgeBuilderService {

    static final String PROXIMITY_METHOD = "proximity_based";

    private final GraphStore graphStore;
    private final EdgeWeightCalculator weightCalculator;
    private final ProvenanceService provenanceService;
    private final EdgeProperties properties;

    public EdgeBuilderServiceImpl(GraphStore graphStore, EdgeWeightCalculator weightCalculator,
                                  ProvenanceService provenanceService, KnowledgeGraphProperties properties) {
        this.graphStore = graphStore;
        this.weightCalculator = weightCalculator;
        this.provenanceService = provenanceService;
        this.properties = properties.getEdges();
    }

    @Override
    public EdgeBuildResult buildEdges(List<RelationshipCandidate> relationships, List<String> sourceRefs,
                                      boolean verifyEntities) {
        long startTime = System.currentTimeMillis();
        List<RelationshipCandidate> batch = relationships != null ? relationships : List.of();
        List<String> refs = sourceRefs != null ? sourceRefs : List.of();

        String operationId = provenanceService.startOperation(ProvenanceService.EDGE_BUILDER, "build_edges",
            refs, Map.of("relationship_count", batch.size(), "verify_entities", verifyEntities));

        EdgeBuildResult.EdgeBuildResultBuilder result = EdgeBuildResult.builder()
            .operationId(operationId)
            .totalCandidates(batch.size());

        if (batch.isEmpty()) {
            log.info("Edge build [{}]: empty batch, nothing to do", operationId);
            provenanceService.completeOperation(operationId, List.of(), true, Map.of("edges_created", 0), null);
            return result.success(true).weightDistribution(WeightDistribution.of(List.of())).build();
        }

        log.info("Edge build [{}]: {} candidates, verification {}", operationId, batch.size(),
            verifyEntities ? "enabled" : "disabled");

        try {
            graphStore.verifyConnectivity();
        } catch (GraphStoreUnavailableException e) {
            return fail(result, operationId, OperationError.unavailable(e.getMessage()), List.of(), List.of(), startTime);
        }

        // Drop malformed and disabled candidates before touching the store
        List<RelationshipCandidate> accepted = new ArrayList<>();
        int skippedInvalid = 0;
        int filtered = 0;
        for (RelationshipCandidate candidate : batch) {
            if (!isWellFormed(candidate)) {
                skippedInvalid++;
                log.warn("Edge build [{}]: skipping malformed candidate {}", operationId, describe(candidate));
                continue;
            }
            if (!properties.isProximityEdgesEnabled() && PROXIMITY_METHOD.equalsIgnoreCase(candidate.getExtractionMethod())) {
                filtered++;
                log.debug("Edge build [{}]: proximity edges disabled, dropping {}", operationId, describe(candidate));
                continue;
            }
            accepted.add(candidate);
        }
        result.skippedInvalid(skippedInvalid).filtered(filtered);

        if (verifyEntities) {
            Set<String> referenced = new LinkedHashSet<>();
            for (RelationshipCandidate candidate : accepted) {
                referenced.add(candidate.getSubjectEntityId());
                referenced.add(candidate.getObjectEntityId());
            }
            Set<String> existing;
            try {
                existing = graphStore.findExistingEntityIds(referenced);
            } catch (GraphStoreUnavailableException e) {
                return fail(result, operationId, OperationError.unavailable(e.getMessage()), List.of(), List.of(), startTime);
            } catch (GraphStoreException e) {
                return fail(result, operationId, OperationError.internal(e.getMessage()), List.of(), List.of(), startTime);
            }

            Set<String> missing = new TreeSet<>(referenced);
            missing.removeAll(existing);
            if (!missing.isEmpty()) {
                List<EdgeFailure> rejected = new ArrayList<>();
                for (RelationshipCandidate candidate : accepted) {
                    List<String> missingForEdge = missingEndpoints(candidate, existing);
                    if (!missingForEdge.isEmpty()) {
                        rejected.add(new EdgeFailure(candidate.getRelationshipId(), candidate.getSubjectEntityId(),
                            candidate.getObjectEntityId(), missingForEdge, "Endpoint entities not found"));
                    }
                }
                log.warn("Edge build [{}]: rejecting batch, {} entities missing: {}",
                    operationId, missing.size(), StoreCallLogger.formatIds(missing));
                return fail(result, operationId, OperationError.missingEntities(new ArrayList<>(missing)),
                    List.of(), rejected, startTime);
            }
        }

        List<GraphRelationship> created = new ArrayList<>();
        List<EdgeFailure> failures = new ArrayList<>();
        for (RelationshipCandidate candidate : accepted) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Edge build [{}]: interrupted after {} edges", operationId, created.size());
                return fail(result, operationId, OperationError.internal("Edge build interrupted"), created, failures, startTime);
            }
            GraphRelationship relationship = toRelationship(candidate, refs);
            try {
                materialize(relationship, failures).ifPresent(created::add);
            } catch (GraphStoreUnavailableException e) {
                return fail(result, operationId, OperationError.unavailable(e.getMessage()), created, failures, startTime);
            } catch (GraphStoreException e) {
                log.warn("Edge build [{}]: failed to create {}: {}", operationId, relationship.getRelationshipId(), e.getMessage());
                failures.add(failure(relationship, List.of(), e.getMessage()));
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Edge build [{}] complete: {} created, {} failed, {} malformed, {} filtered ({}ms)",
            operationId, created.size(), failures.size(), skippedInvalid, filtered, duration);

        provenanceService.completeOperation(operationId,
            created.stream().map(GraphRelationship::getRelationshipId).toList(), true,
            Map.of("edges_created", created.size(), "edges_failed", failures.size()), null);

        return result
            .success(true)
            .edges(created)
            .relationshipTypes(countTypes(created))
            .weightDistribution(WeightDistribution.of(created))
            .failures(failures)
            .durationMs(duration)
            .build();
    }

    @Override
    public List<GraphRelationship> searchRelationships(String relationshipType, Double minWeight, Double maxWeight,
                                                       int limit) {
        int effectiveLimit = Math.min(limit > 0 ? limit : properties.getDefaultSearchLimit(),
            properties.getMaxSearchLimit());
        String type = isBlank(relationshipType) ? null : RelationshipTypes.sanitize(relationshipType);
        List<GraphRelationship> edges = graphStore.searchRelationships(type, minWeight, maxWeight, effectiveLimit);
        log.debug("Relationship search type={}, weight=[{}, {}]: {} edges", type, minWeight, maxWeight, edges.size());
        return edges;
    }

    /**
     * Re-check this edge's endpoints and write it. The graph is the source of truth, so an
     * entity removed after the batch check is still caught here.
     */
    private Optional<GraphRelationship> materialize(GraphRelationship relationship, List<EdgeFailure> failures) {
        Set<String> endpoints = new LinkedHashSet<>(
            List.of(relationship.getSubjectEntityId(), relationship.getObjectEntityId()));
        Set<String> existing = graphStore.findExistingEntityIds(endpoints);
        List<String> missing = endpoints.stream().filter(id -> !existing.contains(id)).toList();
        if (!missing.isEmpty()) {
            log.warn("Relationship {} skipped, missing entities {}", relationship.getRelationshipId(), missing);
            failures.add(failure(relationship, missing, "Endpoint entities not found"));
            return Optional.empty();
        }

        Optional<String> elementId = graphStore.createRelationship(relationship);
        if (elementId.isEmpty()) {
            failures.add(failure(relationship, List.of(), "Endpoints disappeared before the edge was written"));
            return Optional.empty();
        }
        log.debug("Created {} -[{} {}]-> {}", relationship.getSubjectEntityId(), relationship.getRelationshipType(),
            relationship.getWeight(), relationship.getObjectEntityId());
        return Optional.of(relationship);
    }

    private GraphRelationship toRelationship(RelationshipCandidate candidate, List<String> refs) {
        String evidence = StoreCallLogger.truncate(candidate.getEvidenceText(), properties.getMaxEvidenceLength());
        double weight = weightCalculator.calculateWeight(candidate);
        ConfidenceAssessment quality = weightCalculator.assessQuality(candidate, weight, evidence);
        String relationshipId = candidate.getRelationshipId() != null && !candidate.getRelationshipId().isBlank()
            ? candidate.getRelationshipId()
            : UUID.randomUUID().toString();

        return GraphRelationship.builder()
            .relationshipId(relationshipId)
            .subjectEntityId(candidate.getSubjectEntityId())
            .objectEntityId(candidate.getObjectEntityId())
            .relationshipType(RelationshipTypes.sanitize(candidate.getRelationshipType()))
            .weight(weight)
            .confidence(candidate.getConfidence())
            .extractionMethod(candidate.getExtractionMethod())
            .evidenceText(evidence)
            .patternConfidence(candidate.getPatternConfidence())
            .entityDistance(candidate.getEntityDistance())
            .qualityConfidence(quality.getConfidence())
            .qualityTier(quality.getTier())
            .sourceRefs(new ArrayList<>(refs))
            .createdAt(Instant.now())
            .build();
    }

    private boolean isWellFormed(RelationshipCandidate candidate) {
        if (candidate == null) {
            return false;
        }
        if (isBlank(candidate.getSubjectEntityId()) || isBlank(candidate.getObjectEntityId())) {
            return false;
        }
        Double confidence = candidate.getConfidence();
        return confidence != null && !confidence.isNaN() && confidence >= 0.0 && confidence <= 1.0;
    }

    private static List<String> missingEndpoints(RelationshipCandidate candidate, Set<String> existing) {
        Set<String> missing = new LinkedHashSet<>();
        if (!existing.contains(candidate.getSubjectEntityId())) {
            missing.add(candidate.getSubjectEntityId());
        }
        if (!existing.contains(candidate.getObjectEntityId())) {
            missing.add(candidate.getObjectEntityId());
        }
        return new ArrayList<>(missing);
    }

    private static Map<String, Integer> countTypes(List<GraphRelationship> edges) {
        Map<String, Integer> counts = new TreeMap<>();
        for (GraphRelationship edge : edges) {
            counts.merge(edge.getRelationshipType(), 1, Integer::sum);
        }
        return counts;
    }

    private static EdgeFailure failure(GraphRelationship relationship, List<String> missing, String reason) {
        return new EdgeFailure(relationship.getRelationshipId(), relationship.getSubjectEntityId(),
            relationship.getObjectEntityId(), missing, reason);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String describe(RelationshipCandidate candidate) {
        if (candidate == null) {
            return "null";
        }
        return candidate.getSubjectEntityId() + " -[" + candidate.getRelationshipType() + "]-> "
            + candidate.getObjectEntityId();
    }

    private EdgeBuildResult fail(EdgeBuildResult.EdgeBuildResultBuilder result, String operationId, OperationError error,
                                 List<GraphRelationship> created, List<EdgeFailure> failures, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        log.error("Edge build [{}] failed: {}", operationId, error.getMessage());
        provenanceService.completeOperation(operationId,
            created.stream().map(GraphRelationship::getRelationshipId).toList(), false,
            Map.of("error_kind", error.getKind(), "edges_created", created.size()), error.getMessage());
        return result
            .success(false)
            .edges(new ArrayList<>(created))
            .relationshipTypes(countTypes(created))
            .weightDistribution(WeightDistribution.of(created))
            .failures(new ArrayList<>(failures))
            .error(error)
            .durationMs(duration)
            .build();
    }
}
