package de.leipzig.htwk.gitrdf.fixstrategy.model;

/**
 * Outcome of one fix attempt reported back by the orchestrator.
 * Confidence is clamped into [0, 1].
 */
public record FixResult(boolean success, double confidence) {

    public FixResult {
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
