package com.helios.sketchbook.model.ids;

/**
 * Identifier of a dynamic property.
 */
public final class DynPropertyId extends Identifier {

    public DynPropertyId(String id) {
        super(id);
    }

    public static DynPropertyId of(String id) {
        return new DynPropertyId(id);
    }
}
