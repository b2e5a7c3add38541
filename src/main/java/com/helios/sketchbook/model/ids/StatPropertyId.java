package com.helios.sketchbook.model.ids;

/**
 * Identifier of a static property.
 */
public final class StatPropertyId extends Identifier {

    public StatPropertyId(String id) {
        super(id);
    }

    public static StatPropertyId of(String id) {
        return new StatPropertyId(id);
    }
}
