package com.purchasingpower.knowledgegraph.entity;

import com.purchasingpower.knowledgegraph.core.Mention;

import java.util.List;

/**
 * Turns linked mentions into one persisted entity node per entity id.
 */
public interface EntityBuilderService {

    /**
     * Group mentions by entity id, aggregate them and merge the resulting entities into the
     * graph in one transaction.
     *
     * <p>Groups whose id cannot be resolved are skipped and counted. When the datastore is
     * unreachable nothing is written and the result carries a
     * {@code DATASTORE_UNAVAILABLE} error. An empty batch succeeds without touching the store.
     *
     * @param mentions Linked mentions from the extractor
     * @param sourceRefs Documents or chunks the mentions came from
     * @return Build result, never null
     */
    EntityBuildResult buildEntities(List<Mention> mentions, List<String> sourceRefs);
}
