package com.helios.sketchbook.core.inference;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an inference run. Each status lists the statuses it may move to;
 * FINISHED and ERROR are terminal.
 */
public enum InferenceStatus {
    CREATED,
    STARTED,
    PROCESSED_INPUTS,
    GENERATED_GRAPH,
    EVALUATED_STATIC,
    EVALUATED_DYNAMIC,
    FINISHED,
    ERROR;

    public Set<InferenceStatus> successors() {
        return switch (this) {
            case CREATED -> EnumSet.of(STARTED, ERROR);
            case STARTED -> EnumSet.of(PROCESSED_INPUTS, ERROR);
            case PROCESSED_INPUTS -> EnumSet.of(GENERATED_GRAPH, ERROR);
            case GENERATED_GRAPH -> EnumSet.of(EVALUATED_STATIC, ERROR);
            case EVALUATED_STATIC -> EnumSet.of(EVALUATED_DYNAMIC, ERROR);
            case EVALUATED_DYNAMIC -> EnumSet.of(FINISHED, ERROR);
            case FINISHED, ERROR -> EnumSet.noneOf(InferenceStatus.class);
        };
    }

    public boolean canTransitionTo(InferenceStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == FINISHED || this == ERROR;
    }
}
