package com.ttennebkram.intensity.processing;

/**
 * Thrown when a parallel worker fails mid-chunk.
 * The destination buffer contents are unspecified after this is raised.
 */
public class WorkerFailureException extends TransformException {

    public WorkerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
