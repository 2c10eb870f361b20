package com.purchasingpower.knowledgegraph.query;

import com.purchasingpower.knowledgegraph.knowledge.TraversalDirection;
import lombok.Getter;

import java.util.Set;

/**
 * Supported question forms and the traversal each one implies.
 */
@Getter
public enum QueryIntent {

    /** "What companies fund X?" */
    FUNDERS(TraversalDirection.BOTH,
        Set.of("FUNDS", "FUNDED", "FUNDED_BY", "SPONSORS", "SPONSORED_BY", "INVESTED_IN", "INVESTS_IN", "FINANCES")),

    /** "Who works at X?" */
    MEMBERS(TraversalDirection.INCOMING,
        Set.of("WORKS_AT", "WORKS_FOR", "AFFILIATED_WITH", "EMPLOYED_BY", "MEMBER_OF", "STUDIES_AT", "LEADS")),

    /** "Where does X work?" */
    AFFILIATIONS(TraversalDirection.OUTGOING,
        Set.of("WORKS_AT", "WORKS_FOR", "AFFILIATED_WITH", "EMPLOYED_BY", "MEMBER_OF", "STUDIES_AT", "LEADS")),

    /** "What is connected to X?" */
    CONNECTED(TraversalDirection.BOTH, null),

    /** Anything else: seeds are taken from the question's content words. */
    GENERAL(TraversalDirection.BOTH, null);

    private final TraversalDirection direction;

    /** Relationship types followed, or null for every type. */
    private final Set<String> relationshipTypes;

    QueryIntent(TraversalDirection direction, Set<String> relationshipTypes) {
        this.direction = direction;
        this.relationshipTypes = relationshipTypes;
    }
}
