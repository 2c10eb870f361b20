package com.purchasingpower.knowledgegraph.entity.impl;

import com.purchasingpower.knowledgegraph.core.Mention;
import com.purchasingpower.knowledgegraph.entity.EntityIdentity;
import com.purchasingpower.knowledgegraph.entity.IdentityService;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives identity from the mentions themselves: the first non-blank surface form becomes the
 * canonical name and the most frequent type wins (first seen on ties).
 */
@Service
public class MentionIdentityService implements IdentityService {

    static final String UNKNOWN_TYPE = "UNKNOWN";

    @Override
    public Optional<EntityIdentity> lookup(String entityId, List<Mention> mentions) {
        if (entityId == null || entityId.isBlank() || mentions == null) {
            return Optional.empty();
        }

        String canonicalName = null;
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (Mention mention : mentions) {
            String form = mention.getSurfaceForm();
            if (canonicalName == null && form != null && !form.isBlank()) {
                canonicalName = form.trim();
            }
            String type = mention.getEntityType();
            if (type != null && !type.isBlank()) {
                typeCounts.merge(type.trim(), 1, Integer::sum);
            }
        }
        if (canonicalName == null) {
            return Optional.empty();
        }

        String entityType = UNKNOWN_TYPE;
        int best = 0;
        for (Map.Entry<String, Integer> entry : typeCounts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                entityType = entry.getKey();
            }
        }
        return Optional.of(new EntityIdentity(canonicalName, entityType));
    }
}
