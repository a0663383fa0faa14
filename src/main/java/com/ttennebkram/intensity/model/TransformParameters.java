package com.ttennebkram.intensity.model;

import com.google.gson.JsonObject;
import com.ttennebkram.intensity.processing.InvalidParameterException;

import java.util.Locale;

/**
 * Brightness/contrast parameters: {@code out = in * scale + offset}.
 * Scale is the contrast factor, offset the brightness offset.
 * No range is enforced here; results are clamped to 0..255 by the transform.
 */
public final class TransformParameters {

    public static final TransformParameters IDENTITY = new TransformParameters(1.0, 0.0);

    private final double scale;
    private final double offset;

    public TransformParameters(double scale, double offset) {
        this.scale = scale;
        this.offset = offset;
    }

    public static TransformParameters of(double scale, double offset) {
        return new TransformParameters(scale, offset);
    }

    public double getScale() {
        return scale;
    }

    public double getOffset() {
        return offset;
    }

    public boolean isFinite() {
        return Double.isFinite(scale) && Double.isFinite(offset);
    }

    /**
     * @throws InvalidParameterException if scale or offset is NaN or infinite
     */
    public void validate() {
        requireFinite(scale, offset);
    }

    /**
     * @throws InvalidParameterException if scale or offset is NaN or infinite
     */
    public static void requireFinite(double scale, double offset) {
        if (!Double.isFinite(scale)) {
            throw new InvalidParameterException("Scale must be finite, got " + scale);
        }
        if (!Double.isFinite(offset)) {
            throw new InvalidParameterException("Offset must be finite, got " + offset);
        }
    }

    public void serialize(JsonObject json) {
        json.addProperty("scale", scale);
        json.addProperty("offset", offset);
    }

    /**
     * Read scale/offset from JSON, keeping the given defaults for missing keys.
     */
    public static TransformParameters deserialize(JsonObject json, TransformParameters defaults) {
        double scale = json.has("scale") ? json.get("scale").getAsDouble() : defaults.scale;
        double offset = json.has("offset") ? json.get("offset").getAsDouble() : defaults.offset;
        return new TransformParameters(scale, offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransformParameters)) return false;
        TransformParameters that = (TransformParameters) o;
        return Double.compare(scale, that.scale) == 0 && Double.compare(offset, that.offset) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(scale) + Double.hashCode(offset);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "scale=%.3f, offset=%.1f", scale, offset);
    }
}
