package com.helios.sketchbook.model.network;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a regulator must have an observable effect on its target.
 */
public enum Essentiality {
    TRUE, FALSE, UNKNOWN;

    /**
     * Safely converts a string to an Essentiality.
     * @return the matching constant, or null if not found.
     */
    public static Essentiality fromString(String text) {
        if (text == null) return null;
        try {
            return Essentiality.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static Essentiality fromBoolean(boolean essential) {
        return essential ? TRUE : FALSE;
    }

    @JsonValue
    public String getValue() {
        return name();
    }
}
