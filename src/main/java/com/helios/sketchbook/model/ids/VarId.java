package com.helios.sketchbook.model.ids;

/**
 * Identifier of a network variable.
 */
public final class VarId extends Identifier {

    public VarId(String id) {
        super(id);
    }

    public static VarId of(String id) {
        return new VarId(id);
    }
}
