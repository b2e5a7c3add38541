package com.helios.sketchbook.core.error;

/**
 * A property mutator was applied to a variant it does not support.
 */
public class VariantMismatchException extends SketchException {

    public VariantMismatchException(String message) {
        super(message);
    }

    public VariantMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
