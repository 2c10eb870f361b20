package com.purchasingpower.knowledgegraph.entity.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceAssessment;
import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.Mention;
import com.purchasingpower.knowledgegraph.core.OperationError;
import com.purchasingpower.knowledgegraph.entity.EntityBuildResult;
import com.purchasingpower.knowledgegraph.entity.EntityBuilderService;
import com.purchasingpower.knowledgegraph.entity.EntityIdentity;
import com.purchasingpower.knowledgegraph.entity.IdentityService;
import com.purchasingpower.knowledgegraph.exception.GraphStoreException;
import com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.knowledgegraph.knowledge.GraphStore;
import com.purchasingpower.knowledgegraph.provenance.ProvenanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntityBuilderServiceImpl implements EntityBuilderService {

    private final GraphStore graphStore;
    private final IdentityService identityService;
    private final EntityConfidenceCalculator confidenceCalculator;
    private final ProvenanceService provenanceService;

    @Override
    public EntityBuildResult buildEntities(List<Mention> mentions, List<String> sourceRefs) {
        long startTime = System.currentTimeMillis();
        List<Mention> batch = mentions != null ? mentions : List.of();
        List<String> refs = sourceRefs != null ? sourceRefs : List.of();

        String operationId = provenanceService.startOperation(ProvenanceService.ENTITY_BUILDER, "build_entities",
            refs, Map.of("mention_count", batch.size()));

        if (batch.isEmpty()) {
            log.info("Entity build [{}]: empty batch, nothing to do", operationId);
            provenanceService.completeOperation(operationId, List.of(), true, Map.of("entities_created", 0), null);
            return EntityBuildResult.empty(operationId);
        }

        log.info("Entity build [{}]: {} mentions from {} sources", operationId, batch.size(), refs.size());

        try {
            graphStore.verifyConnectivity();
        } catch (GraphStoreUnavailableException e) {
            return fail(operationId, batch.size(), OperationError.unavailable(e.getMessage()), startTime);
        }

        // Group by linked entity id, keeping first-seen order
        Map<String, List<Mention>> groups = new LinkedHashMap<>();
        int unlinked = 0;
        for (Mention mention : batch) {
            if (mention == null || mention.getEntityId() == null || mention.getEntityId().isBlank()) {
                unlinked++;
                continue;
            }
            groups.computeIfAbsent(mention.getEntityId().trim(), id -> new ArrayList<>()).add(mention);
        }
        if (unlinked > 0) {
            log.warn("Entity build [{}]: {} mentions carry no entity id and were skipped", operationId, unlinked);
        }

        List<GraphEntity> resolved = new ArrayList<>();
        Map<String, String> mapping = new LinkedHashMap<>();
        int skippedGroups = 0;
        for (Map.Entry<String, List<Mention>> group : groups.entrySet()) {
            Optional<GraphEntity> entity = resolveGroup(group.getKey(), group.getValue(), refs);
            if (entity.isEmpty()) {
                skippedGroups++;
                log.warn("Entity build [{}]: could not resolve identity for '{}' ({} mentions), skipping",
                    operationId, group.getKey(), group.getValue().size());
                continue;
            }
            resolved.add(entity.get());
            for (Mention mention : group.getValue()) {
                if (mention.getMentionId() != null) {
                    mapping.put(mention.getMentionId(), group.getKey());
                }
            }
        }

        List<GraphEntity> stored;
        try {
            stored = graphStore.storeEntities(resolved);
        } catch (GraphStoreUnavailableException e) {
            return fail(operationId, batch.size(), OperationError.unavailable(e.getMessage()), startTime);
        } catch (GraphStoreException e) {
            return fail(operationId, batch.size(), OperationError.internal(e.getMessage()), startTime);
        }

        Map<String, Integer> byType = new TreeMap<>();
        for (GraphEntity entity : stored) {
            byType.merge(entity.getEntityType() != null ? entity.getEntityType() : "UNKNOWN", 1, Integer::sum);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Entity build [{}] complete: {} entities, {} groups skipped, {} unlinked mentions ({}ms)",
            operationId, stored.size(), skippedGroups, unlinked, duration);

        provenanceService.completeOperation(operationId,
            stored.stream().map(GraphEntity::getEntityId).toList(), true,
            Map.of("entities_created", stored.size(), "skipped_groups", skippedGroups, "entity_types", byType),
            null);

        return EntityBuildResult.builder()
            .success(true)
            .operationId(operationId)
            .entities(stored)
            .entitiesByType(byType)
            .entityIdMapping(mapping)
            .totalMentions(batch.size())
            .skippedGroups(skippedGroups)
            .unlinkedMentions(unlinked)
            .durationMs(duration)
            .build();
    }

    private Optional<GraphEntity> resolveGroup(String entityId, List<Mention> mentions, List<String> batchRefs) {
        Optional<EntityIdentity> identity = identityService.lookup(entityId, mentions);
        if (identity.isEmpty()) {
            return Optional.empty();
        }

        Set<String> surfaceForms = new LinkedHashSet<>();
        Set<String> sourceRefs = new LinkedHashSet<>(batchRefs);
        List<String> mentionRefs = new ArrayList<>();
        for (Mention mention : mentions) {
            if (mention.getSurfaceForm() != null && !mention.getSurfaceForm().isBlank()) {
                surfaceForms.add(mention.getSurfaceForm().trim());
            }
            if (mention.getSourceRef() != null) {
                sourceRefs.add(mention.getSourceRef());
            }
            if (mention.getMentionId() != null) {
                mentionRefs.add(mention.getMentionId());
            }
        }

        String name = identity.get().canonicalName();
        String type = identity.get().entityType();
        double confidence = confidenceCalculator.aggregateConfidence(mentions, type, surfaceForms.size());
        ConfidenceAssessment quality = confidenceCalculator.assessQuality(confidence, mentions.size(), name, type);

        return Optional.of(GraphEntity.builder()
            .entityId(entityId)
            .canonicalName(name)
            .entityType(type)
            .surfaceForms(new ArrayList<>(surfaceForms))
            .mentionCount(mentions.size())
            .confidence(confidence)
            .qualityConfidence(quality.getConfidence())
            .qualityTier(quality.getTier())
            .mentionRefs(mentionRefs)
            .sourceRefs(new ArrayList<>(sourceRefs))
            .createdAt(Instant.now())
            .build());
    }

    private EntityBuildResult fail(String operationId, int totalMentions, OperationError error, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        log.error("Entity build [{}] failed: {}", operationId, error.getMessage());
        provenanceService.completeOperation(operationId, List.of(), false, Map.of("error_kind", error.getKind()),
            error.getMessage());
        return EntityBuildResult.failure(operationId, totalMentions, error, duration);
    }
}
