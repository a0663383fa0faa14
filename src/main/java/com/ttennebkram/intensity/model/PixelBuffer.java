package com.ttennebkram.intensity.model;

import com.ttennebkram.intensity.processing.ShapeMismatchException;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Row-major view over a 3-channel (BGR) 8-bit image stored in one contiguous byte array.
 *
 * Each row starts at {@code row * rowStride}. Only the first {@code cols * 3} bytes of a
 * row are pixel data (the active region); any remaining bytes up to the stride are padding.
 *
 * The buffer does not copy the array it wraps. Whoever created the array owns it.
 */
public final class PixelBuffer {

    /** Channels per pixel, BGR byte order. */
    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final int rowStride;
    private final byte[] data;

    /**
     * Wrap an existing array.
     *
     * @param width     pixels per row
     * @param height    number of rows
     * @param rowStride bytes from the start of one row to the start of the next
     * @param data      backing storage, exactly {@code rowStride * height} bytes
     * @throws ShapeMismatchException if the shape is inconsistent with the storage
     */
    public PixelBuffer(int width, int height, int rowStride, byte[] data) {
        if (width < 0 || height < 0) {
            throw new ShapeMismatchException("Negative dimensions: " + width + "x" + height);
        }
        if (data == null) {
            throw new ShapeMismatchException("Backing storage is null");
        }
        long activeBytes = (long) width * CHANNELS;
        if (rowStride < activeBytes) {
            throw new ShapeMismatchException("Row stride " + rowStride
                    + " is smaller than " + width + " pixels * " + CHANNELS + " channels");
        }
        long expected = (long) rowStride * height;
        if (data.length != expected) {
            throw new ShapeMismatchException("Storage length " + data.length
                    + " does not match rowStride * height = " + expected);
        }
        this.width = width;
        this.height = height;
        this.rowStride = rowStride;
        this.data = data;
    }

    /**
     * Allocate a zero-filled buffer without row padding.
     */
    public static PixelBuffer allocate(int width, int height) {
        return allocate(width, height, checkedSize((long) width * CHANNELS, "row"));
    }

    /**
     * Allocate a zero-filled buffer with the given row stride.
     */
    public static PixelBuffer allocate(int width, int height, int rowStride) {
        if (width < 0 || height < 0 || rowStride < 0) {
            throw new ShapeMismatchException("Negative shape: " + width + "x" + height
                    + " stride " + rowStride);
        }
        int size = checkedSize((long) rowStride * height, "buffer");
        return new PixelBuffer(width, height, rowStride, new byte[size]);
    }

    private static int checkedSize(long size, String what) {
        if (size > Integer.MAX_VALUE) {
            throw new ShapeMismatchException("Image " + what + " of " + size
                    + " bytes exceeds the maximum array size");
        }
        return (int) size;
    }

    /**
     * Wrap a packed (unpadded) array.
     */
    public static PixelBuffer wrap(int width, int height, byte[] data) {
        return new PixelBuffer(width, height, checkedSize((long) width * CHANNELS, "row"), data);
    }

    public int rows() {
        return height;
    }

    public int cols() {
        return width;
    }

    public int channels() {
        return CHANNELS;
    }

    public int rowStride() {
        return rowStride;
    }

    /** Number of pixel bytes per row, excluding padding. */
    public int activeRowBytes() {
        return width * CHANNELS;
    }

    public int paddingBytes() {
        return rowStride - activeRowBytes();
    }

    public boolean hasPadding() {
        return rowStride != activeRowBytes();
    }

    /**
     * The whole backing array, padding included. Writes go straight to the image.
     */
    public byte[] data() {
        return data;
    }

    /** Offset into {@link #data()} of the first byte of a row. */
    public int rowOffset(int row) {
        checkRow(row);
        return row * rowStride;
    }

    /**
     * View over the active bytes of one row. Padding is not part of the view.
     */
    public ByteBuffer row(int row) {
        return ByteBuffer.wrap(data, rowOffset(row), activeRowBytes()).slice();
    }

    /** Unsigned value of one channel of one pixel. */
    public int get(int row, int col, int channel) {
        return data[index(row, col, channel)] & 0xFF;
    }

    public void set(int row, int col, int channel, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Byte value out of range: " + value);
        }
        data[index(row, col, channel)] = (byte) value;
    }

    private int index(int row, int col, int channel) {
        checkRow(row);
        if (col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("Column " + col + " outside 0.." + (width - 1));
        }
        if (channel < 0 || channel >= CHANNELS) {
            throw new IndexOutOfBoundsException("Channel " + channel + " outside 0.." + (CHANNELS - 1));
        }
        return row * rowStride + col * CHANNELS + channel;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= height) {
            throw new IndexOutOfBoundsException("Row " + row + " outside 0.." + (height - 1));
        }
    }

    /** True if both buffers have the same width, height and row stride. */
    public boolean sameShape(PixelBuffer other) {
        return other != null
                && width == other.width
                && height == other.height
                && rowStride == other.rowStride;
    }

    /**
     * @throws ShapeMismatchException if {@code other} differs in width, height or stride
     */
    public void requireSameShape(PixelBuffer other) {
        if (!sameShape(other)) {
            throw new ShapeMismatchException("Shape mismatch: " + describe() + " vs "
                    + (other == null ? "null" : other.describe()));
        }
    }

    /** New zero-filled buffer with this buffer's width, height and stride. */
    public PixelBuffer allocateLike() {
        return new PixelBuffer(width, height, rowStride, new byte[data.length]);
    }

    /** Deep copy, padding included. */
    public PixelBuffer copy() {
        return new PixelBuffer(width, height, rowStride, data.clone());
    }

    /**
     * Compare the active regions of two same-shaped buffers. Padding bytes are ignored.
     */
    public boolean activeRegionEquals(PixelBuffer other) {
        if (!sameShape(other)) {
            return false;
        }
        int active = activeRowBytes();
        for (int r = 0; r < height; r++) {
            int from = r * rowStride;
            if (!Arrays.equals(data, from, from + active,
                    other.data, from, from + active)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copy the active region into a new packed array of {@code cols * rows * 3} bytes.
     */
    public byte[] packActive() {
        int active = activeRowBytes();
        if (!hasPadding()) {
            return data.clone();
        }
        byte[] packed = new byte[active * height];
        for (int r = 0; r < height; r++) {
            System.arraycopy(data, r * rowStride, packed, r * active, active);
        }
        return packed;
    }

    /**
     * Overwrite the active region from a packed array. Padding is left untouched.
     */
    public void unpackActive(byte[] packed) {
        int active = activeRowBytes();
        if (packed.length != active * height) {
            throw new ShapeMismatchException("Packed length " + packed.length
                    + " does not match " + width + "x" + height + "x" + CHANNELS);
        }
        for (int r = 0; r < height; r++) {
            System.arraycopy(packed, r * active, data, r * rowStride, active);
        }
    }

    public String describe() {
        return width + "x" + height + "x" + CHANNELS + " (stride " + rowStride + ")";
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + describe() + "]";
    }
}
