package com.purchasingpower.knowledgegraph.entity;

/**
 * Identity data for one linked entity id.
 *
 * @param canonicalName Display name stored on the node
 * @param entityType Entity type stored on the node
 */
public record EntityIdentity(String canonicalName, String entityType) {
}
