package com.ttennebkram.intensity.processing;

import com.ttennebkram.intensity.model.TransformParameters;

/**
 * Builds the 256-entry table used by the lookup strategies.
 *
 * <pre>
 * table[v] = clamp(round(v * scale + offset), 0, 255)
 * </pre>
 *
 * Rounding is to nearest with ties away from zero. Every lookup strategy goes through
 * this class so they all agree byte for byte.
 */
public final class LookupTableBuilder {

    /** Number of distinct 8-bit input values. */
    public static final int TABLE_SIZE = 256;

    private LookupTableBuilder() {
    }

    /**
     * Build a fresh table. The returned array is not shared with anyone.
     *
     * @throws InvalidParameterException if scale or offset is not finite
     */
    public static byte[] build(double scale, double offset) {
        TransformParameters.requireFinite(scale, offset);
        byte[] table = new byte[TABLE_SIZE];
        for (int v = 0; v < TABLE_SIZE; v++) {
            table[v] = (byte) adjustValue(v, scale, offset);
        }
        return table;
    }

    public static byte[] build(TransformParameters params) {
        return build(params.getScale(), params.getOffset());
    }

    /**
     * Transform one unsigned byte value. Inputs must already be finite.
     */
    static int adjustValue(int value, double scale, double offset) {
        double rounded = roundHalfAwayFromZero(value * scale + offset);
        if (rounded <= 0.0) {
            return 0;
        }
        if (rounded >= 255.0) {
            return 255;
        }
        return (int) rounded;
    }

    /**
     * Round to nearest, ties away from zero. Math.round rounds ties toward positive
     * infinity, which differs for negative halves.
     */
    static double roundHalfAwayFromZero(double x) {
        double magnitude = Math.abs(x);
        double floor = Math.floor(magnitude);
        double rounded = (magnitude - floor >= 0.5) ? floor + 1.0 : floor;
        return Math.copySign(rounded, x);
    }
}
