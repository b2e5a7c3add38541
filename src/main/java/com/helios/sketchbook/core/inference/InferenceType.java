package com.helios.sketchbook.core.inference;

/**
 * Which property groups an inference run evaluates.
 */
public enum InferenceType {
    /** Static and dynamic properties. */
    FULL,
    /** Static properties only. */
    STATIC,
    /** Dynamic properties only. */
    DYNAMIC;

    /**
     * @return the matching type, or null if not found.
     */
    public static InferenceType fromString(String text) {
        if (text == null) return null;
        try {
            return InferenceType.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean includesStatic() {
        return this != DYNAMIC;
    }

    public boolean includesDynamic() {
        return this != STATIC;
    }
}
