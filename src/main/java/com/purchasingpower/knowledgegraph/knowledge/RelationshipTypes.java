package com.purchasingpower.knowledgegraph.knowledge;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes free-form relationship labels into identifiers that are safe to splice into a
 * Cypher relationship pattern.
 */
public final class RelationshipTypes {

    public static final String DEFAULT_TYPE = "RELATED_TO";

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^A-Za-z0-9_]");

    private RelationshipTypes() {
    }

    public static String sanitize(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            return DEFAULT_TYPE;
        }
        String sanitized = UNSAFE_CHARACTERS.matcher(relationshipType.trim()).replaceAll("_")
            .toUpperCase(Locale.ROOT);
        if (!Character.isLetter(sanitized.charAt(0))) {
            sanitized = "REL_" + sanitized;
        }
        return sanitized;
    }
}
