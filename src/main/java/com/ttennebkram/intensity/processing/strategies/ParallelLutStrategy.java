package com.ttennebkram.intensity.processing.strategies;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.processing.LookupTableBuilder;
import com.ttennebkram.intensity.processing.StrategyInfo;
import com.ttennebkram.intensity.processing.TransformStrategyBase;
import com.ttennebkram.intensity.processing.WorkerPool;

/**
 * Flat data-parallel lookup-table transform.
 *
 * Splits the whole backing array into byte ranges, ignoring row boundaries, so padding
 * bytes are transformed along with pixel data. Output therefore only matches the other
 * lookup strategies on the active region of each row.
 */
@StrategyInfo(
    name = ParallelLutStrategy.NAME,
    description = "Lookup table, worker pool over the flat byte array (padding included)",
    transformsPadding = true
)
public class ParallelLutStrategy extends TransformStrategyBase {

    public static final String NAME = "Own (Parallel)";

    /** Smallest byte range handed to a worker. */
    public static final int MIN_CHUNK_BYTES = 4096;

    private final WorkerPool pool;
    private final int minChunkBytes;

    public ParallelLutStrategy(WorkerPool pool) {
        this(pool, MIN_CHUNK_BYTES);
    }

    public ParallelLutStrategy(WorkerPool pool, int minChunkBytes) {
        this.pool = pool;
        this.minChunkBytes = minChunkBytes;
    }

    @Override
    protected void transform(PixelBuffer source, PixelBuffer destination, double scale, double offset) {
        byte[] table = LookupTableBuilder.build(scale, offset);
        byte[] src = source.data();
        byte[] dst = destination.data();
        int length = src.length;
        pool.forEachRange(length, pool.chunkSizeFor(length, minChunkBytes),
                (start, end) -> applyTable(table, src, dst, start, end));
    }
}
