package com.helios.sketchbook.model.ids;

/**
 * Identifier of a dataset.
 */
public final class DatasetId extends Identifier {

    public DatasetId(String id) {
        super(id);
    }

    public static DatasetId of(String id) {
        return new DatasetId(id);
    }
}
