package com.helios.sketchbook.core.error;

/**
 * An operation was invoked in a lifecycle state where it is not allowed.
 */
public class InvalidStateException extends SketchException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
