package com.ttennebkram.intensity.processing;

/**
 * Base class for all errors raised by the transform engine.
 * Transform failures are deterministic for a given input, so none are retried.
 */
public class TransformException extends RuntimeException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
