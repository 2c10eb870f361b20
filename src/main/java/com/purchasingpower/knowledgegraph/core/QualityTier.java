package com.purchasingpower.knowledgegraph.core;

/**
 * Discrete confidence bucket.
 */
public enum QualityTier {
    HIGH,
    MEDIUM,
    LOW
}
