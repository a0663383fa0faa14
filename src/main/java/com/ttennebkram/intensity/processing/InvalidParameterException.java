package com.ttennebkram.intensity.processing;

/**
 * Thrown when scale or offset is NaN or infinite.
 */
public class InvalidParameterException extends TransformException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
