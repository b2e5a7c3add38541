package com.helios.sketchbook.core.error;

/**
 * Base type of every failure raised while building, checking or evaluating a sketch.
 *
 * Unchecked so that the model mutators and the inference pipeline stay free of
 * throws clauses; callers that care catch the concrete subtype.
 */
public class SketchException extends RuntimeException {

    public SketchException(String message) {
        super(message);
    }

    public SketchException(String message, Throwable cause) {
        super(message, cause);
    }

    public SketchException(Throwable cause) {
        super(cause);
    }
}
