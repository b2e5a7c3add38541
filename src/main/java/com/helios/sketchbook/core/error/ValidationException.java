package com.helios.sketchbook.core.error;

/**
 * Malformed input: an invalid identifier, formula syntax, bound or a failed consistency check.
 */
public class ValidationException extends SketchException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
