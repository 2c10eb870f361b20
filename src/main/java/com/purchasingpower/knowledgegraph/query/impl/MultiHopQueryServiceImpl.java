package com.purchasingpower.knowledgegraph.query.impl;

import com.purchasingpower.knowledgegraph.confidence.ConfidenceModel;
import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.configuration.QueryProperties;
import com.purchasingpower.knowledgegraph.core.GraphEntity;
import com.purchasingpower.knowledgegraph.core.OperationError;
import com.purchasingpower.knowledgegraph.exception.GraphStoreException;
import com.purchasingpower.knowledgegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.knowledgegraph.knowledge.GraphStore;
import com.purchasingpower.knowledgegraph.knowledge.NeighborHop;
import com.purchasingpower.knowledgegraph.provenance.ProvenanceService;
import com.purchasingpower.knowledgegraph.query.MultiHopQueryService;
import com.purchasingpower.knowledgegraph.query.ParsedQuery;
import com.purchasingpower.knowledgegraph.query.QueryAnswer;
import com.purchasingpower.knowledgegraph.query.QueryIntent;
import com.purchasingpower.knowledgegraph.query.QueryRequest;
import com.purchasingpower.knowledgegraph.query.QueryResponse;
import com.purchasingpower.knowledgegraph.query.QueryStage;
import com.purchasingpower.knowledgegraph.query.QueryStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class MultiHopQueryServiceImpl implements MultiHopQueryService {

    private final GraphStore graphStore;
    private final QueryParser queryParser;
    private final ProvenanceService provenanceService;
    private final QueryProperties properties;

    public MultiHopQueryServiceImpl(GraphStore graphStore, QueryParser queryParser,
                                    ProvenanceService provenanceService, KnowledgeGraphProperties properties) {
        this.graphStore = graphStore;
        this.queryParser = queryParser;
        this.provenanceService = provenanceService;
        this.properties = properties.getQuery();
    }

    /**
     * Best path found so far to one entity.
     */
    private record PathState(GraphEntity entity, int hops, double pathWeight, List<String> names,
                             List<String> relationshipTypes, boolean seed) {

        PathState extend(NeighborHop hop) {
            List<String> nextNames = new ArrayList<>(names);
            nextNames.add(hop.getNeighbor().getCanonicalName());
            List<String> nextTypes = new ArrayList<>(relationshipTypes);
            nextTypes.add(hop.getRelationshipType());
            return new PathState(hop.getNeighbor(), hops + 1, pathWeight * ConfidenceModel.clamp(hop.getWeight()),
                nextNames, nextTypes, false);
        }
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        long startTime = System.currentTimeMillis();
        String question = request != null ? request.getQuestion() : null;

        // PARSE
        Optional<OperationError> invalid = validate(request);
        if (invalid.isPresent()) {
            log.warn("Query rejected: {}", invalid.get().getMessage());
            return QueryResponse.failure(question, QueryStage.PARSE, invalid.get(), elapsed(startTime));
        }
        int maxHops = Math.min(request.getMaxHops() != null ? request.getMaxHops() : properties.getDefaultMaxHops(),
            properties.getMaxHopsLimit());
        int resultLimit = Math.min(
            request.getResultLimit() != null ? request.getResultLimit() : properties.getDefaultResultLimit(),
            properties.getMaxResultLimit());

        ParsedQuery parsed = queryParser.parse(question);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("intent", parsed.intent().name());
        params.put("max_hops", maxHops);
        params.put("result_limit", resultLimit);
        String operationId = provenanceService.startOperation(ProvenanceService.MULTIHOP_QUERY, "multihop_query",
            List.of(question), params);
        log.info("Query [{}] PARSE: intent={}, terms={}, answer types={}, max hops={}", operationId,
            parsed.intent(), parsed.seedTerms(), parsed.answerTypes(), maxHops);

        QueryStage stage = QueryStage.SEED;
        try {
            // SEED
            List<GraphEntity> seeds = resolveSeeds(request, parsed);
            log.info("Query [{}] SEED: {} seeds resolved", operationId, seeds.size());
            if (seeds.isEmpty()) {
                provenanceService.completeOperation(operationId, List.of(), true, Map.of("results", 0), null);
                return QueryResponse.builder()
                    .success(true)
                    .question(question)
                    .intent(parsed.intent())
                    .stage(QueryStage.ANSWER)
                    .stats(QueryStats.builder().build())
                    .durationMs(elapsed(startTime))
                    .build();
            }

            // EXPAND
            stage = QueryStage.EXPAND;
            QueryStats.QueryStatsBuilder stats = QueryStats.builder().seedCount(seeds.size());
            Map<String, PathState> reached = expand(seeds, parsed.intent(), maxHops, stats);
            log.debug("Query [{}] EXPAND: reached {} entities", operationId, reached.size());

            // SCORE
            stage = QueryStage.SCORE;
            List<QueryAnswer> candidates = new ArrayList<>();
            for (PathState path : reached.values()) {
                if (!path.seed() && !matchesAnswerType(path.entity(), parsed.answerTypes())) {
                    continue;
                }
                candidates.add(toAnswer(path, score(path)));
            }
            candidates.sort(Comparator
                .comparing((QueryAnswer answer) -> answer.getHopCount() == 0)
                .thenComparing(QueryAnswer::getConfidence, Comparator.reverseOrder())
                .thenComparing(QueryAnswer::getAnswerEntityId));

            // ANSWER
            stage = QueryStage.ANSWER;
            List<QueryAnswer> results = candidates.size() > resultLimit
                ? new ArrayList<>(candidates.subList(0, resultLimit))
                : candidates;
            double averageConfidence = results.stream().mapToDouble(QueryAnswer::getConfidence).average().orElse(0.0);
            QueryStats finalStats = stats.averageConfidence(averageConfidence).build();

            long duration = elapsed(startTime);
            log.info("Query [{}] ANSWER: {} results from {} candidates ({}ms)", operationId, results.size(),
                candidates.size(), duration);
            provenanceService.completeOperation(operationId,
                results.stream().map(QueryAnswer::getAnswerEntityId).toList(), true,
                Map.of("results", results.size(), "entities_visited", finalStats.getEntitiesVisited()), null);

            return QueryResponse.builder()
                .success(true)
                .question(question)
                .intent(parsed.intent())
                .stage(QueryStage.ANSWER)
                .seedEntities(seeds.stream().map(GraphEntity::getCanonicalName).toList())
                .results(results)
                .totalResults(results.size())
                .stats(finalStats)
                .durationMs(duration)
                .build();
        } catch (GraphStoreUnavailableException e) {
            return fail(operationId, question, stage, OperationError.unavailable(e.getMessage()), startTime);
        } catch (GraphStoreException e) {
            return fail(operationId, question, stage, OperationError.internal(e.getMessage()), startTime);
        }
    }

    private Optional<OperationError> validate(QueryRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            return Optional.of(OperationError.validation("Question must not be blank"));
        }
        if (request.getMaxHops() != null && request.getMaxHops() < 0) {
            return Optional.of(OperationError.validation("max_hops must not be negative: " + request.getMaxHops()));
        }
        if (request.getResultLimit() != null && request.getResultLimit() < 1) {
            return Optional.of(OperationError.validation("result_limit must be at least 1: " + request.getResultLimit()));
        }
        return Optional.empty();
    }

    /**
     * Caller-supplied entity ids win; otherwise parsed terms are looked up in order until
     * enough seeds are found or the term budget is spent. A term with an exact name match
     * seeds only its exact matches; partial matches are used only when there is none.
     */
    private List<GraphEntity> resolveSeeds(QueryRequest request, ParsedQuery parsed) {
        Map<String, GraphEntity> seeds = new LinkedHashMap<>();
        if (request.getQueryEntities() != null && !request.getQueryEntities().isEmpty()) {
            for (String entityId : new LinkedHashSet<>(request.getQueryEntities())) {
                if (seeds.size() >= properties.getMaxSeeds()) {
                    break;
                }
                graphStore.getEntity(entityId).ifPresent(entity -> seeds.put(entity.getEntityId(), entity));
            }
            return new ArrayList<>(seeds.values());
        }

        int lookups = 0;
        for (String term : parsed.seedTerms()) {
            if (seeds.size() >= properties.getMaxSeeds()) {
                break;
            }
            if (lookups >= properties.getMaxSeedTerms()) {
                log.debug("Seed lookup stopped after {} terms", lookups);
                break;
            }
            lookups++;
            List<GraphEntity> found = graphStore.searchEntities(term, null, properties.getCandidatesPerTerm());
            String lowered = term.toLowerCase(Locale.ROOT);
            List<GraphEntity> exact = found.stream().filter(entity -> isExactMatch(entity, lowered)).toList();
            List<GraphEntity> matches = exact.isEmpty() ? found : exact;
            for (GraphEntity match : matches) {
                if (seeds.size() >= properties.getMaxSeeds()) {
                    break;
                }
                seeds.putIfAbsent(match.getEntityId(), match);
            }
            // terms arrive longest first; stop at the first one that resolves
            if (!seeds.isEmpty() && parsed.intent() != QueryIntent.GENERAL) {
                break;
            }
        }
        return new ArrayList<>(seeds.values());
    }

    /**
     * Level-by-level breadth-first expansion from all seeds at once. An entity keeps the best
     * path of the level it was first reached on.
     */
    private Map<String, PathState> expand(List<GraphEntity> seeds, QueryIntent intent, int maxHops,
                                          QueryStats.QueryStatsBuilder stats) {
        Map<String, PathState> reached = new LinkedHashMap<>();
        List<String> frontier = new ArrayList<>();
        for (GraphEntity seed : seeds) {
            List<String> names = new ArrayList<>();
            names.add(seed.getCanonicalName());
            reached.put(seed.getEntityId(), new PathState(seed, 0, 1.0, names, new ArrayList<>(), true));
            frontier.add(seed.getEntityId());
        }

        int pathsExplored = 0;
        int depth = 0;
        boolean truncated = false;
        boolean neighborsCut = false;
        while (depth < maxHops && !frontier.isEmpty() && !truncated) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Query expansion interrupted at hop {}", depth);
                truncated = true;
                break;
            }

            List<NeighborHop> hops = graphStore.findNeighbors(frontier, intent.getDirection(),
                intent.getRelationshipTypes(), properties.getMaxVisitedEntities());
            pathsExplored += hops.size();
            if (hops.size() >= properties.getMaxVisitedEntities()) {
                // the store cut the neighbour list at the limit
                neighborsCut = true;
            }

            Map<String, PathState> level = new LinkedHashMap<>();
            for (NeighborHop hop : hops) {
                String neighborId = hop.getNeighbor().getEntityId();
                if (reached.containsKey(neighborId)) {
                    continue;
                }
                PathState from = reached.get(hop.getFromEntityId());
                if (from == null) {
                    continue;
                }
                PathState candidate = from.extend(hop);
                PathState best = level.get(neighborId);
                if (best == null || candidate.pathWeight() > best.pathWeight()) {
                    if (best == null && reached.size() + level.size() >= properties.getMaxVisitedEntities()) {
                        truncated = true;
                        continue;
                    }
                    level.put(neighborId, candidate);
                }
            }

            reached.putAll(level);
            frontier = new ArrayList<>(level.keySet());
            depth++;
        }

        stats.pathsExplored(pathsExplored)
            .entitiesVisited(reached.size())
            .hopsTraversed(depth)
            .truncated(truncated || neighborsCut);
        return reached;
    }

    /**
     * Product of edge weights, decayed per extra hop, scaled by the answer's own confidence
     * and boosted by its rank score. A seed scores its own confidence.
     */
    private double score(PathState path) {
        GraphEntity entity = path.entity();
        if (path.hops() == 0) {
            return ConfidenceModel.clamp(entity.getConfidence());
        }
        double decay = Math.pow(properties.getHopDecay(), path.hops() - 1);
        double entityFactor = 0.5 + 0.5 * ConfidenceModel.clamp(entity.getConfidence());
        double boost = Math.min(properties.getPageRankBoostCap(),
            Math.max(0.0, entity.getPageRankScore()) * properties.getPageRankBoostFactor());
        return ConfidenceModel.clamp(path.pathWeight() * decay * entityFactor * (1.0 + boost));
    }

    private QueryAnswer toAnswer(PathState path, double confidence) {
        GraphEntity entity = path.entity();
        return QueryAnswer.builder()
            .answer(entity.getCanonicalName())
            .answerEntityId(entity.getEntityId())
            .entityType(entity.getEntityType())
            .confidence(Math.round(confidence * 1000.0) / 1000.0)
            .explanation(explain(path))
            .path(path.names())
            .relationshipPath(path.relationshipTypes())
            .hopCount(path.hops())
            .build();
    }

    private static String explain(PathState path) {
        if (path.hops() == 0) {
            return path.entity().getCanonicalName() + " matches the query directly";
        }
        if (path.hops() == 1) {
            return "Directly connected to " + path.names().get(0) + " via " + path.relationshipTypes().get(0);
        }
        List<String> intermediates = path.names().subList(1, path.names().size() - 1);
        return "Connected to " + path.names().get(0) + " through " + String.join(", ", intermediates)
            + " via " + String.join(" → ", path.relationshipTypes());
    }

    private static boolean matchesAnswerType(GraphEntity entity, Set<String> answerTypes) {
        return answerTypes == null || answerTypes.isEmpty()
            || (entity.getEntityType() != null && answerTypes.contains(entity.getEntityType()));
    }

    private static boolean isExactMatch(GraphEntity entity, String loweredTerm) {
        if (entity.getCanonicalName() != null && entity.getCanonicalName().toLowerCase(Locale.ROOT).equals(loweredTerm)) {
            return true;
        }
        return entity.getSurfaceForms().stream()
            .anyMatch(form -> form != null && form.toLowerCase(Locale.ROOT).equals(loweredTerm));
    }

    private QueryResponse fail(String operationId, String question, QueryStage stage, OperationError error,
                               long startTime) {
        log.error("Query [{}] failed at {}: {}", operationId, stage, error.getMessage());
        provenanceService.completeOperation(operationId, List.of(), false, Map.of("stage", stage.name()),
            error.getMessage());
        return QueryResponse.failure(question, stage, error, elapsed(startTime));
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
