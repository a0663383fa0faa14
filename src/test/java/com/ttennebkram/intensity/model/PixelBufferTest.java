package com.ttennebkram.intensity.model;

import static org.junit.jupiter.api.Assertions.*;

import com.ttennebkram.intensity.processing.ShapeMismatchException;
import java.nio.ByteBuffer;
import org.junit.jupiter.api.*;

class PixelBufferTest {

    @Nested
    class Construction {

        @Test
        void packedBufferHasNoPadding() {
            PixelBuffer buffer = PixelBuffer.allocate(4, 2);
            assertEquals(2, buffer.rows());
            assertEquals(4, buffer.cols());
            assertEquals(3, buffer.channels());
            assertEquals(12, buffer.rowStride());
            assertEquals(12, buffer.activeRowBytes());
            assertFalse(buffer.hasPadding());
            assertEquals(24, buffer.data().length);
        }

        @Test
        void paddedBuffer() {
            PixelBuffer buffer = PixelBuffer.allocate(2, 3, 8);
            assertTrue(buffer.hasPadding());
            assertEquals(2, buffer.paddingBytes());
            assertEquals(24, buffer.data().length);
            assertEquals(16, buffer.rowOffset(2));
        }

        @Test
        void strideSmallerThanRowIsRejected() {
            assertThrows(ShapeMismatchException.class,
                         () -> new PixelBuffer(4, 2, 11, new byte[22]));
        }

        @Test
        void storageLengthMustMatch() {
            assertThrows(ShapeMismatchException.class,
                         () -> new PixelBuffer(2, 2, 6, new byte[11]));
            assertThrows(ShapeMismatchException.class,
                         () -> new PixelBuffer(2, 2, 6, new byte[13]));
        }

        @Test
        void negativeDimensionsAreRejected() {
            assertThrows(ShapeMismatchException.class,
                         () -> new PixelBuffer(-1, 2, 0, new byte[0]));
            assertThrows(ShapeMismatchException.class,
                         () -> PixelBuffer.allocate(2, -1));
        }

        @Test
        void oversizedAllocationIsRejected() {
            assertThrows(ShapeMismatchException.class,
                         () -> PixelBuffer.allocate(100_000, 100_000));
            assertThrows(ShapeMismatchException.class,
                         () -> PixelBuffer.allocate(Integer.MAX_VALUE / 2, 1));
            assertThrows(ShapeMismatchException.class,
                         () -> PixelBuffer.allocate(10, 1 << 20, 1 << 12));
        }

        @Test
        void nullStorageIsRejected() {
            assertThrows(ShapeMismatchException.class,
                         () -> new PixelBuffer(1, 1, 3, null));
        }

        @Test
        void emptyBufferIsAllowed() {
            PixelBuffer buffer = PixelBuffer.allocate(0, 0);
            assertEquals(0, buffer.data().length);
        }
    }

    @Nested
    class Access {

        @Test
        void getAndSetUseStride() {
            PixelBuffer buffer = PixelBuffer.allocate(2, 2, 8);
            buffer.set(1, 1, 2, 200);
            assertEquals(200, buffer.get(1, 1, 2));
            // row 1 starts at 8, pixel 1 at +3, channel 2 at +2
            assertEquals((byte) 200, buffer.data()[13]);
        }

        @Test
        void getReturnsUnsignedValues() {
            byte[] data = {(byte) 255, (byte) 128, 0};
            PixelBuffer buffer = PixelBuffer.wrap(1, 1, data);
            assertEquals(255, buffer.get(0, 0, 0));
            assertEquals(128, buffer.get(0, 0, 1));
        }

        @Test
        void outOfBoundsAccessFails() {
            PixelBuffer buffer = PixelBuffer.allocate(2, 2, 8);
            assertThrows(IndexOutOfBoundsException.class, () -> buffer.get(2, 0, 0));
            assertThrows(IndexOutOfBoundsException.class, () -> buffer.get(0, 2, 0));
            assertThrows(IndexOutOfBoundsException.class, () -> buffer.get(0, 0, 3));
            assertThrows(IllegalArgumentException.class, () -> buffer.set(0, 0, 0, 256));
        }

        @Test
        void rowViewExcludesPadding() {
            byte[] data = {1, 2, 3, 4, 5, 6, 99, 99,
                           7, 8, 9, 10, 11, 12, 99, 99};
            PixelBuffer buffer = new PixelBuffer(2, 2, 8, data);
            ByteBuffer row = buffer.row(1);
            assertEquals(6, row.remaining());
            assertEquals(7, row.get(0));
            assertEquals(12, row.get(5));
        }
    }

    @Nested
    class Comparison {

        @Test
        void activeRegionEqualsIgnoresPadding() {
            byte[] a = {1, 2, 3, 0, 4, 5, 6, 0};
            byte[] b = {1, 2, 3, 7, 4, 5, 6, 9};
            PixelBuffer left = new PixelBuffer(1, 2, 4, a);
            PixelBuffer right = new PixelBuffer(1, 2, 4, b);
            assertTrue(left.activeRegionEquals(right));

            b[5] = 42;
            assertFalse(left.activeRegionEquals(right));
        }

        @Test
        void differentStrideIsNotSameShape() {
            PixelBuffer packed = PixelBuffer.allocate(2, 2);
            PixelBuffer padded = PixelBuffer.allocate(2, 2, 8);
            assertFalse(packed.sameShape(padded));
            assertFalse(packed.activeRegionEquals(padded));
            assertThrows(ShapeMismatchException.class, () -> packed.requireSameShape(padded));
        }

        @Test
        void allocateLikeKeepsShape() {
            PixelBuffer padded = PixelBuffer.allocate(3, 5, 12);
            PixelBuffer like = padded.allocateLike();
            assertTrue(padded.sameShape(like));
            assertNotSame(padded.data(), like.data());
        }

        @Test
        void packAndUnpackSkipPadding() {
            byte[] data = {1, 2, 3, 9, 4, 5, 6, 9};
            PixelBuffer buffer = new PixelBuffer(1, 2, 4, data);
            assertArrayEquals(new byte[] {1, 2, 3, 4, 5, 6}, buffer.packActive());

            buffer.unpackActive(new byte[] {10, 20, 30, 40, 50, 60});
            assertArrayEquals(new byte[] {10, 20, 30, 9, 40, 50, 60, 9}, buffer.data());

            assertThrows(ShapeMismatchException.class, () -> buffer.unpackActive(new byte[5]));
        }
    }
}
