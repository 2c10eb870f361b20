package com.purchasingpower.knowledgegraph.knowledge;

/**
 * Edge direction followed when expanding from an entity.
 */
public enum TraversalDirection {
    OUTGOING,
    INCOMING,
    BOTH
}
