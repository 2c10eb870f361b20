package com.purchasingpower.knowledgegraph.confidence;

/**
 * One named signal fed into {@link ConfidenceModel#combine}. Values are clamped to [0,1];
 * weights are relative and normalized per call.
 */
public record ConfidenceFactor(double value, double weight) {

    public ConfidenceFactor {
        if (Double.isNaN(value) || Double.isNaN(weight)) {
            throw new IllegalArgumentException("Confidence factor must be a number");
        }
        if (weight < 0.0) {
            throw new IllegalArgumentException("Confidence factor weight must not be negative: " + weight);
        }
    }

    public static ConfidenceFactor of(double value) {
        return new ConfidenceFactor(value, 1.0);
    }

    public static ConfidenceFactor of(double value, double weight) {
        return new ConfidenceFactor(value, weight);
    }
}
