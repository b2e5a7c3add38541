package com.helios.sketchbook.core.error;

/**
 * Failure reported by the symbolic engine or the temporal-logic model checker.
 */
public class ExternalEngineException extends SketchException {

    public ExternalEngineException(String message) {
        super(message);
    }

    public ExternalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
