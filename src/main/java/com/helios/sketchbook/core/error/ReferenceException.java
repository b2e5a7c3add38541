package com.helios.sketchbook.core.error;

/**
 * A name (variable, dataset, observation, property, wildcard) that does not resolve to an existing entity.
 */
public class ReferenceException extends SketchException {

    public ReferenceException(String message) {
        super(message);
    }

    public ReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
