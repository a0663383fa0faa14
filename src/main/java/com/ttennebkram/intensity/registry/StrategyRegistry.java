package com.ttennebkram.intensity.registry;

import com.ttennebkram.intensity.processing.StrategyInfo;
import com.ttennebkram.intensity.processing.TransformStrategy;
import com.ttennebkram.intensity.processing.WorkerPool;
import com.ttennebkram.intensity.processing.strategies.OpenCVConvertToStrategy;
import com.ttennebkram.intensity.processing.strategies.ParallelLutStrategy;
import com.ttennebkram.intensity.processing.strategies.ParallelRowsLutStrategy;
import com.ttennebkram.intensity.processing.strategies.SequentialLutStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps strategy names to TransformStrategy instances.
 *
 * Built once at startup and handed to whoever needs it; there is no global instance.
 * Names keep registration order so a selection list shows them in a stable order.
 *
 * Usage:
 *   StrategyRegistry registry = StrategyRegistry.createDefault(WorkerPool.shared());
 *   for (String name : registry.names()) combo.getItems().add(name);
 *   registry.require(name).apply(src, dst, scale, offset);
 */
public class StrategyRegistry {

    private final Map<String, TransformStrategy> strategies = new LinkedHashMap<>();

    /**
     * Registry holding the four built-in strategies, the data-parallel ones running on
     * {@code pool}.
     */
    public static StrategyRegistry createDefault(WorkerPool pool) {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(new OpenCVConvertToStrategy());
        registry.register(new SequentialLutStrategy());
        registry.register(new ParallelLutStrategy(pool));
        registry.register(new ParallelRowsLutStrategy(pool));
        return registry;
    }

    /**
     * Register a strategy under an explicit name.
     * An existing entry with the same name is replaced.
     */
    public synchronized void register(String name, TransformStrategy strategy) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Strategy name must not be empty");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("Strategy must not be null");
        }
        strategies.put(name, strategy);
    }

    /**
     * Register a strategy under the name declared by its {@link StrategyInfo}.
     */
    public void register(TransformStrategy strategy) {
        StrategyInfo info = strategy.getClass().getAnnotation(StrategyInfo.class);
        if (info == null) {
            throw new IllegalArgumentException(strategy.getClass().getName()
                    + " has no @StrategyInfo; register it with an explicit name");
        }
        register(info.name(), strategy);
    }

    /**
     * Look up a strategy by exact name.
     */
    public synchronized Optional<TransformStrategy> get(String name) {
        return Optional.ofNullable(strategies.get(name));
    }

    /**
     * Look up a strategy by exact name.
     *
     * @throws StrategyNotFoundException if nothing is registered under {@code name}
     */
    public TransformStrategy require(String name) {
        return get(name).orElseThrow(() -> new StrategyNotFoundException(name));
    }

    public synchronized boolean contains(String name) {
        return strategies.containsKey(name);
    }

    /**
     * All registered names, in registration order.
     */
    public synchronized List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(strategies.keySet()));
    }

    /**
     * Names of strategies that are not references, in registration order.
     */
    public synchronized List<String> ownStrategyNames() {
        List<String> own = new ArrayList<>();
        for (Map.Entry<String, TransformStrategy> entry : strategies.entrySet()) {
            if (!entry.getValue().isReference()) {
                own.add(entry.getKey());
            }
        }
        return Collections.unmodifiableList(own);
    }

    public synchronized int size() {
        return strategies.size();
    }
}
