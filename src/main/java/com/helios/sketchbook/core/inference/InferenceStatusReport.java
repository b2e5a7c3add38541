package com.helios.sketchbook.core.inference;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the status log of an inference run.
 *
 * @param elapsedMs     milliseconds since the run started
 * @param numCandidates remaining candidate networks, or null before the graph exists
 */
public record InferenceStatusReport(InferenceStatus status, Instant timestamp, long elapsedMs,
                                    BigInteger numCandidates, String message) {

    public InferenceStatusReport {
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        message = message != null ? message : "";
    }

    /**
     * Renders the report as {@code > 12ms: message (n candidates)}.
     */
    public String format() {
        String candidates = numCandidates != null ? " (" + numCandidates + " candidates)" : "";
        return "> " + elapsedMs + "ms: " + message + candidates;
    }
}
