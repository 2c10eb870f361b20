package com.purchasingpower.knowledgegraph.query;

/**
 * Stages a query passes through, in order.
 */
public enum QueryStage {
    PARSE,
    SEED,
    EXPAND,
    SCORE,
    ANSWER
}
