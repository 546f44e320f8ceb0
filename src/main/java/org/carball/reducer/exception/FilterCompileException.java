package org.carball.reducer.exception;

/**
 * A filter rule the caller has to correct. Always raised before anything reaches the engine.
 */
public abstract class FilterCompileException extends IllegalArgumentException {

    protected FilterCompileException(String message) {
        super(message);
    }
}
