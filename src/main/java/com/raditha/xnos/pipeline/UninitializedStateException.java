package com.raditha.xnos.pipeline;

/**
 * Thrown when a pass runs against a {@link PipelineContext} that was never
 * initialised with a pandoc version.
 */
public class UninitializedStateException extends IllegalStateException {

    public UninitializedStateException(String message) {
        super(message);
    }
}
