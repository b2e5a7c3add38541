package com.helios.sketchbook.core.error;

/**
 * An inference run was stopped through its cancellation flag.
 */
public class InferenceCancelledException extends SketchException {

    public InferenceCancelledException(String message) {
        super(message);
    }
}
