package com.helios.sketchbook.model.network;

import com.helios.sketchbook.model.ids.VarId;

import java.util.Objects;

/**
 * A network variable with its display name and free-form annotation.
 */
public record Variable(VarId id, String name, String annotation) {

    public Variable {
        Objects.requireNonNull(id, "Variable id cannot be null");
        name = name != null ? name : id.asStr();
        annotation = annotation != null ? annotation : "";
    }

    public Variable(VarId id) {
        this(id, id.asStr(), "");
    }
}
