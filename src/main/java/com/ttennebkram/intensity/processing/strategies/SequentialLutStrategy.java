package com.ttennebkram.intensity.processing.strategies;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.processing.LookupTableBuilder;
import com.ttennebkram.intensity.processing.StrategyInfo;
import com.ttennebkram.intensity.processing.TransformStrategyBase;

/**
 * Single-threaded lookup-table transform.
 * Walks the active bytes of every row on the calling thread; padding is not touched.
 */
@StrategyInfo(
    name = SequentialLutStrategy.NAME,
    description = "Lookup table, single thread, row by row"
)
public class SequentialLutStrategy extends TransformStrategyBase {

    public static final String NAME = "Own (Sequential)";

    @Override
    protected void transform(PixelBuffer source, PixelBuffer destination, double scale, double offset) {
        byte[] table = LookupTableBuilder.build(scale, offset);
        applyTableToRows(table, source, destination, 0, source.rows());
    }
}
