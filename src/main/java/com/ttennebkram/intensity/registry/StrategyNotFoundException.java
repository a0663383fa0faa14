package com.ttennebkram.intensity.registry;

import com.ttennebkram.intensity.processing.TransformException;

/**
 * Thrown when a strategy name is not registered.
 */
public class StrategyNotFoundException extends TransformException {

    private final String strategyName;

    public StrategyNotFoundException(String strategyName) {
        super("No transform strategy registered as '" + strategyName + "'");
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
