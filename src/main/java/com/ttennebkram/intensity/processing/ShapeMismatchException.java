package com.ttennebkram.intensity.processing;

/**
 * Thrown when buffer dimensions, row stride or backing storage are inconsistent,
 * either within one buffer or between a source and its destination.
 */
public class ShapeMismatchException extends TransformException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
