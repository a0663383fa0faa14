package com.ttennebkram.intensity.processing;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Metadata for a TransformStrategy implementation.
 * The registry reads the name from here when a strategy is registered without one.
 *
 * Example usage:
 * <pre>
 * {@literal @}StrategyInfo(
 *     name = "Own (Sequential)",
 *     description = "Single-threaded lookup table over active bytes"
 * )
 * public class SequentialLutStrategy extends TransformStrategyBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface StrategyInfo {

    /**
     * Name shown in selection lists (e.g., "Own (Parallel Rows)").
     * Must be unique within a registry.
     */
    String name();

    /**
     * Short description for tooltips and --list output.
     */
    String description() default "";

    /**
     * Whether this strategy delegates to an external library and only serves as a
     * reference. Reference strategies are left out of equivalence checks.
     */
    boolean reference() default false;

    /**
     * Whether the strategy also rewrites row padding bytes in the destination.
     */
    boolean transformsPadding() default false;
}
