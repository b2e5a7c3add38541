package com.helios.sketchbook.model.properties;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminant of the dynamic property variants.
 */
public enum DynPropertyKind {
    GENERIC("GenericDynProp"),
    EXISTS_FIXED_POINT("ExistsFixedPoint"),
    EXISTS_TRAP_SPACE("ExistsTrapSpace"),
    EXISTS_TRAJECTORY("ExistsTrajectory"),
    ATTRACTOR_COUNT("AttractorCount"),
    HAS_ATTRACTOR("HasAttractor");

    private final String tag;

    DynPropertyKind(String tag) {
        this.tag = tag;
    }

    /**
     * Converts a serialized tag (or enum name) to a kind.
     * @return the matching kind, or null if not found.
     */
    public static DynPropertyKind fromString(String text) {
        if (text == null) return null;
        for (DynPropertyKind kind : values()) {
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
