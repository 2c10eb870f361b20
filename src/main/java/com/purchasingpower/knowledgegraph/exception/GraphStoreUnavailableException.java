package com.purchasingpower.knowledgegraph.exception;

/**
 * The graph datastore cannot be reached. Stages that see this fail the whole call.
 */
public class GraphStoreUnavailableException extends RuntimeException {

    public GraphStoreUnavailableException(String message) {
        super(message);
    }

    public GraphStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
