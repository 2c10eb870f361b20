package com.purchasingpower.knowledgegraph.util;

import org.slf4j.Logger;

import java.util.Collection;

/**
 * Logging helpers for datastore calls and for keeping user-supplied text short.
 */
public final class StoreCallLogger {

    private StoreCallLogger() {
    }

    public static StoreCallContext startCall(String operation, Logger logger) {
        return new StoreCallContext(operation, logger);
    }

    /**
     * Cut {@code text} to at most {@code maxLength} characters without splitting a surrogate
     * pair. Null stays null.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    /**
     * Render an id collection for a log line without flooding it.
     */
    public static String formatIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return "[]";
        }
        if (ids.size() <= 5) {
            return ids.toString();
        }
        return "[" + ids.size() + " ids]";
    }
}
