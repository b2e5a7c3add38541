package com.helios.sketchbook.core.error;

/**
 * A property kind that the evaluation pipeline cannot translate into constraints yet.
 */
public class NotYetSupportedException extends SketchException {

    public NotYetSupportedException(String message) {
        super(message);
    }

    public NotYetSupportedException(String message, Throwable cause) {
        super(message, cause);
    }
}
