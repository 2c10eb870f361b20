package com.purchasingpower.knowledgegraph.query;

/**
 * Answers natural-language questions by bounded breadth-first traversal from seed entities.
 */
public interface MultiHopQueryService {

    /**
     * Run PARSE, SEED, EXPAND, SCORE and ANSWER for one question.
     *
     * <p>Never throws for an unanswerable question: when no seed resolves the response is
     * successful with no results. Fails only for a malformed request or an unreachable store.
     * Repeating a query on an unchanged graph returns the same answers in the same order.
     */
    QueryResponse query(QueryRequest request);
}
