package com.ttennebkram.intensity.processing;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.model.TransformParameters;

/**
 * Abstract base class for strategies.
 * Validates parameters and shapes once so subclasses only implement the loop.
 */
public abstract class TransformStrategyBase implements TransformStrategy {

    @Override
    public final void apply(PixelBuffer source, PixelBuffer destination, double scale, double offset) {
        TransformParameters.requireFinite(scale, offset);
        if (source == null || destination == null) {
            throw new ShapeMismatchException("Source and destination buffers are required");
        }
        source.requireSameShape(destination);
        if (source.rows() == 0 || source.cols() == 0) {
            return;
        }
        transform(source, destination, scale, offset);
    }

    /**
     * Do the actual work. Called with validated, same-shaped, non-empty buffers.
     */
    protected abstract void transform(PixelBuffer source, PixelBuffer destination,
                                      double scale, double offset);

    /**
     * Name from the {@link StrategyInfo} annotation, or the simple class name.
     */
    public String getName() {
        StrategyInfo info = getClass().getAnnotation(StrategyInfo.class);
        return info != null ? info.name() : getClass().getSimpleName();
    }

    /**
     * Apply the table to bytes {@code [from, to)} of source, writing the same range of
     * destination.
     */
    protected static void applyTable(byte[] table, byte[] src, byte[] dst, int from, int to) {
        for (int i = from; i < to; i++) {
            dst[i] = table[src[i] & 0xFF];
        }
    }

    /**
     * Apply the table to the active bytes of rows {@code [firstRow, endRow)}.
     */
    protected static void applyTableToRows(byte[] table, PixelBuffer source, PixelBuffer destination,
                                           int firstRow, int endRow) {
        byte[] src = source.data();
        byte[] dst = destination.data();
        int stride = source.rowStride();
        int active = source.activeRowBytes();
        for (int r = firstRow; r < endRow; r++) {
            int start = r * stride;
            applyTable(table, src, dst, start, start + active);
        }
    }

    @Override
    public String toString() {
        return getName();
    }
}
