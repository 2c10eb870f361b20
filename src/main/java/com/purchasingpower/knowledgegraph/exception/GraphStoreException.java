package com.purchasingpower.knowledgegraph.exception;

import lombok.Getter;

/**
 * A single datastore statement failed while the store itself stayed reachable.
 */
@Getter
public class GraphStoreException extends RuntimeException {

    private final String operation;

    public GraphStoreException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }
}
