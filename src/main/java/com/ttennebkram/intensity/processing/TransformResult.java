package com.ttennebkram.intensity.processing;

import com.ttennebkram.intensity.model.PixelBuffer;

/**
 * Output of a timed transform call.
 */
public class TransformResult {

    private final PixelBuffer output;
    private final String strategyName;
    private final long elapsedNanos;

    public TransformResult(PixelBuffer output, String strategyName, long elapsedNanos) {
        this.output = output;
        this.strategyName = strategyName;
        this.elapsedNanos = elapsedNanos;
    }

    public PixelBuffer getOutput() {
        return output;
    }

    /** Name of the strategy that actually ran (after any fallback). */
    public String getStrategyName() {
        return strategyName;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public double getElapsedMillis() {
        return elapsedNanos / 1e6;
    }
}
