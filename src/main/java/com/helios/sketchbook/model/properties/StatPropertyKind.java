package com.helios.sketchbook.model.properties;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminant of the static property variants.
 */
public enum StatPropertyKind {
    GENERIC("GenericStatProp"),
    REGULATION_ESSENTIAL("RegulationEssential"),
    REGULATION_ESSENTIAL_CONTEXT("RegulationEssentialContext"),
    REGULATION_MONOTONIC("RegulationMonotonic"),
    REGULATION_MONOTONIC_CONTEXT("RegulationMonotonicContext"),
    FN_INPUT_ESSENTIAL("FnInputEssential"),
    FN_INPUT_ESSENTIAL_CONTEXT("FnInputEssentialContext"),
    FN_INPUT_MONOTONIC("FnInputMonotonic"),
    FN_INPUT_MONOTONIC_CONTEXT("FnInputMonotonicContext");

    private final String tag;

    StatPropertyKind(String tag) {
        this.tag = tag;
    }

    /**
     * @return the kind with this tag (or enum name), or null if not found.
     */
    public static StatPropertyKind fromString(String text) {
        if (text == null) return null;
        for (StatPropertyKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(text) || kind.name().equalsIgnoreCase(text)) {
                return kind;
            }
        }
        return null;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
