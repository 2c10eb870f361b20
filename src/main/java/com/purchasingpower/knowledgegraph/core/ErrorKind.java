package com.purchasingpower.knowledgegraph.core;

/**
 * Classes of hard failure reported on batch and query results.
 */
public enum ErrorKind {
    /** Empty or malformed request. */
    VALIDATION,
    /** The datastore could not be reached; nothing was written. */
    DATASTORE_UNAVAILABLE,
    /** Edges reference entities that do not exist in the store. */
    REFERENTIAL_INTEGRITY,
    /** Anything else. */
    INTERNAL
}
