package com.purchasingpower.knowledgegraph.util;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call to the graph datastore: a short call id, timing and consistent
 * request/response/error log lines.
 *
 * @see StoreCallLogger
 */
public class StoreCallContext {

    private static final String STORE = "Neo4j";

    private final String callId;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    StoreCallContext(String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(Object... details) {
        logger.debug("{} → {} [{}]", STORE, operation, callId);
        logDetails(details);
    }

    public void logResponse(Object... details) {
        logger.debug("{} ← {} [{}] ({}ms)", STORE, operation, callId, getElapsedMs());
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} ✖ {} [{}] ({}ms) - {}", STORE, operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    private void logDetails(Object... details) {
        if (details == null || !logger.isDebugEnabled()) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }
}
