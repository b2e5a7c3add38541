package com.helios.sketchbook.model.network;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sign of a regulation.
 */
public enum Monotonicity {
    ACTIVATION("->"),
    INHIBITION("-|"),
    DUAL("-*"),
    UNKNOWN("-?");

    private final String arrow;

    Monotonicity(String arrow) {
        this.arrow = arrow;
    }

    /**
     * Arrow symbol used by the annotated text format.
     */
    public String arrow() {
        return arrow;
    }

    /**
     * Safely converts a string to a Monotonicity.
     * @param text the name, case-insensitive.
     * @return the matching constant, or null if not found.
     */
    public static Monotonicity fromString(String text) {
        if (text == null) return null;
        try {
            return Monotonicity.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static Monotonicity fromArrow(String arrow) {
        for (Monotonicity m : values()) {
            if (m.arrow.equals(arrow)) {
                return m;
            }
        }
        return null;
    }

    @JsonValue
    public String getValue() {
        return name();
    }
}
