package com.di.rawingest.exception;

/**
 * Thrown when the ingest pipeline finishes in any state other than DONE.
 */
public class PipelineRunException extends RuntimeException {

    public PipelineRunException(String message) {
        super(message);
    }
}
