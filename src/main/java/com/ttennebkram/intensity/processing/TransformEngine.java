package com.ttennebkram.intensity.processing;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.model.TransformParameters;
import com.ttennebkram.intensity.registry.StrategyNotFoundException;
import com.ttennebkram.intensity.registry.StrategyRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for callers that pick a strategy by name.
 *
 * The engine holds no current selection: every call names its strategy and carries its
 * own parameters. Unknown names fall back to the default strategy.
 */
public class TransformEngine {

    private final StrategyRegistry registry;
    private final String defaultStrategyName;

    public TransformEngine(StrategyRegistry registry, String defaultStrategyName) {
        this.registry = registry;
        this.defaultStrategyName = defaultStrategyName;
    }

    public StrategyRegistry getRegistry() {
        return registry;
    }

    public String getDefaultStrategyName() {
        return defaultStrategyName;
    }

    /**
     * Name of the strategy that will run for {@code requested}: the name itself if
     * registered, otherwise the default.
     *
     * @throws StrategyNotFoundException if neither is registered
     */
    public String resolveName(String requested) {
        if (requested != null && registry.contains(requested)) {
            return requested;
        }
        if (!registry.contains(defaultStrategyName)) {
            throw new StrategyNotFoundException(requested != null ? requested : defaultStrategyName);
        }
        System.err.println("[TransformEngine] Unknown strategy '" + requested
                + "', falling back to '" + defaultStrategyName + "'");
        return defaultStrategyName;
    }

    public TransformStrategy resolve(String requested) {
        return registry.require(resolveName(requested));
    }

    /**
     * Transform into a newly allocated buffer shaped like {@code source}.
     */
    public PixelBuffer apply(String strategyName, PixelBuffer source, TransformParameters params) {
        return applyTimed(strategyName, source, params).getOutput();
    }

    /**
     * Transform into a caller-supplied buffer. {@code destination} may be {@code source}.
     */
    public void apply(String strategyName, PixelBuffer source, PixelBuffer destination,
                      TransformParameters params) {
        resolve(strategyName).apply(source, destination, params);
    }

    /**
     * Transform into a new buffer and report how long the strategy took.
     */
    public TransformResult applyTimed(String strategyName, PixelBuffer source, TransformParameters params) {
        String name = resolveName(strategyName);
        TransformStrategy strategy = registry.require(name);
        PixelBuffer destination = source.allocateLike();

        long t0 = System.nanoTime();
        strategy.apply(source, destination, params);
        long elapsed = System.nanoTime() - t0;

        return new TransformResult(destination, name, elapsed);
    }

    /**
     * Run every registered strategy {@code iterations} times on the same input.
     *
     * @return mean milliseconds per call, keyed by strategy name in registration order
     */
    public Map<String, Double> benchmark(PixelBuffer source, TransformParameters params, int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be at least 1, got " + iterations);
        }
        Map<String, Double> means = new LinkedHashMap<>();
        PixelBuffer destination = source.allocateLike();
        for (String name : registry.names()) {
            TransformStrategy strategy = registry.require(name);
            // Warm-up call, not timed
            strategy.apply(source, destination, params);
            long total = 0;
            for (int i = 0; i < iterations; i++) {
                long t0 = System.nanoTime();
                strategy.apply(source, destination, params);
                total += System.nanoTime() - t0;
            }
            means.put(name, total / 1e6 / iterations);
        }
        return means;
    }
}
