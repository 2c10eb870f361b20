package com.purchasingpower.knowledgegraph.entity;

import com.purchasingpower.knowledgegraph.core.Mention;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a pre-assigned entity id to the identity data stored on its node.
 */
public interface IdentityService {

    /**
     * @param entityId Id assigned by the upstream linking step
     * @param mentions Every mention in the batch linked to {@code entityId}, in input order
     * @return Identity data, or empty when the id cannot be resolved
     */
    Optional<EntityIdentity> lookup(String entityId, List<Mention> mentions);
}
