package com.ttennebkram.intensity.processing;

import static org.junit.jupiter.api.Assertions.*;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.processing.strategies.OpenCVConvertToStrategy;
import com.ttennebkram.intensity.processing.strategies.ParallelLutStrategy;
import com.ttennebkram.intensity.processing.strategies.ParallelRowsLutStrategy;
import com.ttennebkram.intensity.processing.strategies.SequentialLutStrategy;
import com.ttennebkram.intensity.registry.StrategyRegistry;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.*;

class EquivalenceOracleTest {

    private static WorkerPool pool;

    @BeforeAll
    static void createPool() {
        pool = new WorkerPool(4);
    }

    @AfterAll
    static void closePool() {
        pool.close();
    }

    private static StrategyRegistry ownStrategies() {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(new SequentialLutStrategy());
        registry.register(new ParallelLutStrategy(pool, 256));
        registry.register(new ParallelRowsLutStrategy(pool));
        return registry;
    }

    @RepeatedTest(20)
    void ownStrategiesAgreeOnRandomInput(RepetitionInfo repetition) {
        EquivalenceOracle oracle = new EquivalenceOracle(ownStrategies(),
                new Random(1000L + repetition.getCurrentRepetition()));
        oracle.check(oracle.randomTrial());
    }

    @Test
    void defaultRegistryPassesWithoutRunningTheReference() {
        // The OpenCV strategy is registered but excluded, so no native library is needed
        StrategyRegistry registry = StrategyRegistry.createDefault(pool);
        EquivalenceOracle oracle = new EquivalenceOracle(registry, new Random(3));

        assertFalse(registry.ownStrategyNames().contains(OpenCVConvertToStrategy.NAME));
        oracle.check(5);
    }

    @Test
    void runAllProducesOneOutputPerOwnStrategy() {
        EquivalenceOracle oracle = new EquivalenceOracle(ownStrategies(), new Random(11));
        Map<String, PixelBuffer> outputs = oracle.runAll(oracle.randomTrial());
        assertEquals(3, outputs.size());
    }

    @Test
    void randomTrialsStayInBounds() {
        EquivalenceOracle oracle = new EquivalenceOracle(ownStrategies(), new Random(5));
        for (int i = 0; i < 200; i++) {
            EquivalenceOracle.Trial trial = oracle.randomTrial();
            assertTrue(trial.source.rows() >= 1 && trial.source.rows() < EquivalenceOracle.MAX_DIMENSION);
            assertTrue(trial.source.cols() >= 1 && trial.source.cols() < EquivalenceOracle.MAX_DIMENSION);
            assertTrue(trial.source.paddingBytes() <= EquivalenceOracle.MAX_PADDING);
            assertTrue(trial.scale >= 0.0 && trial.scale < 2.0);
            assertTrue(trial.offset >= -100.0 && trial.offset < 100.0);
        }
    }

    @Test
    void truncatingStrategyIsRejected() {
        StrategyRegistry registry = ownStrategies();
        registry.register("Truncating", (source, destination, scale, offset) -> {
            byte[] src = source.data();
            byte[] dst = destination.data();
            for (int i = 0; i < src.length; i++) {
                int v = (int) ((src[i] & 0xFF) * scale + offset);
                dst[i] = (byte) Math.max(0, Math.min(255, v));
            }
        });

        // 1 * 1.5 = 1.5: rounds to 2, truncates to 1
        PixelBuffer source = PixelBuffer.wrap(1, 1, new byte[] {1, 3, 5});
        EquivalenceOracle oracle = new EquivalenceOracle(registry, new Random(0));

        assertThrows(AssertionError.class,
                     () -> oracle.check(new EquivalenceOracle.Trial(source, 1.5, 0.0)));
    }

    @Test
    void needsAtLeastTwoStrategies() {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(new SequentialLutStrategy());
        EquivalenceOracle oracle = new EquivalenceOracle(registry, new Random(0));
        assertThrows(AssertionError.class, () -> oracle.check(1));
    }
}
