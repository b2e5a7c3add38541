package com.helios.sketchbook.model.ids;

/**
 * Identifier of an uninterpreted update function symbol.
 */
public final class FunctionId extends Identifier {

    public FunctionId(String id) {
        super(id);
    }

    public static FunctionId of(String id) {
        return new FunctionId(id);
    }
}
