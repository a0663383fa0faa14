package com.ttennebkram.intensity.processing.strategies;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.processing.LookupTableBuilder;
import com.ttennebkram.intensity.processing.StrategyInfo;
import com.ttennebkram.intensity.processing.TransformStrategyBase;
import com.ttennebkram.intensity.processing.WorkerPool;

/**
 * Row-chunked data-parallel lookup-table transform.
 * Each worker gets a band of whole rows and only touches their active bytes, so
 * destination padding keeps whatever it held before the call.
 */
@StrategyInfo(
    name = ParallelRowsLutStrategy.NAME,
    description = "Lookup table, worker pool over bands of whole rows"
)
public class ParallelRowsLutStrategy extends TransformStrategyBase {

    public static final String NAME = "Own (Parallel Rows)";

    private final WorkerPool pool;
    private final int minRowsPerChunk;

    public ParallelRowsLutStrategy(WorkerPool pool) {
        this(pool, 1);
    }

    public ParallelRowsLutStrategy(WorkerPool pool, int minRowsPerChunk) {
        this.pool = pool;
        this.minRowsPerChunk = minRowsPerChunk;
    }

    @Override
    protected void transform(PixelBuffer source, PixelBuffer destination, double scale, double offset) {
        byte[] table = LookupTableBuilder.build(scale, offset);
        int rows = source.rows();
        pool.forEachRange(rows, pool.chunkSizeFor(rows, minRowsPerChunk),
                (firstRow, endRow) -> applyTableToRows(table, source, destination, firstRow, endRow));
    }
}
