package com.helios.sketchbook.model.ids;

/**
 * Identifier of an observation, unique within its dataset.
 */
public final class ObservationId extends Identifier {

    public ObservationId(String id) {
        super(id);
    }

    public static ObservationId of(String id) {
        return new ObservationId(id);
    }
}
