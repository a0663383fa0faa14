package com.ttennebkram.intensity.processing;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.model.TransformParameters;

/**
 * A way of applying {@code dst = clamp(round(src * scale + offset))} to every pixel byte.
 *
 * Implementations differ only in how the work is executed. Source and destination must
 * have the same shape; they may be the same buffer for an in-place transform.
 * Implementations keep no state between calls.
 */
@FunctionalInterface
public interface TransformStrategy {

    /**
     * Transform {@code source} into {@code destination}.
     * Blocks until the whole destination is written.
     *
     * @throws ShapeMismatchException     if the buffers differ in width, height or stride
     * @throws InvalidParameterException  if scale or offset is not finite
     * @throws WorkerFailureException     if a parallel worker fails
     */
    void apply(PixelBuffer source, PixelBuffer destination, double scale, double offset);

    default void apply(PixelBuffer source, PixelBuffer destination, TransformParameters params) {
        apply(source, destination, params.getScale(), params.getOffset());
    }

    /**
     * Whether this strategy is only a reference (excluded from equivalence checks).
     */
    default boolean isReference() {
        StrategyInfo info = getClass().getAnnotation(StrategyInfo.class);
        return info != null && info.reference();
    }

    /**
     * Whether padding bytes of the destination are rewritten too.
     */
    default boolean transformsPadding() {
        StrategyInfo info = getClass().getAnnotation(StrategyInfo.class);
        return info != null && info.transformsPadding();
    }

    default String getDescription() {
        StrategyInfo info = getClass().getAnnotation(StrategyInfo.class);
        return info != null ? info.description() : "";
    }
}
