package com.ttennebkram.intensity.util;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.processing.ShapeMismatchException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Copies pixel data between OpenCV Mats and PixelBuffers.
 * Only 8-bit images are accepted. Callers must have loaded OpenCV first.
 */
public final class MatBuffers {

    private MatBuffers() {
    }

    /**
     * Copy an 8-bit Mat into a new packed PixelBuffer.
     * Grayscale input is expanded to BGR; 4-channel input drops alpha.
     *
     * @throws ShapeMismatchException if the Mat is not 8-bit with 1, 3 or 4 channels
     */
    public static PixelBuffer fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            return PixelBuffer.allocate(0, 0);
        }
        if (mat.depth() != CvType.CV_8U) {
            throw new ShapeMismatchException("Expected an 8-bit image, got " + CvType.typeToString(mat.type()));
        }

        Mat bgr = mat;
        boolean converted = false;
        if (mat.channels() == 1) {
            bgr = new Mat();
            Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_GRAY2BGR);
            converted = true;
        } else if (mat.channels() == 4) {
            bgr = new Mat();
            Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_BGRA2BGR);
            converted = true;
        } else if (mat.channels() != PixelBuffer.CHANNELS) {
            throw new ShapeMismatchException("Unsupported channel count: " + mat.channels());
        }

        try {
            int w = bgr.cols();
            int h = bgr.rows();
            byte[] data = new byte[w * h * PixelBuffer.CHANNELS];
            bgr.get(0, 0, data);
            return PixelBuffer.wrap(w, h, data);
        } finally {
            if (converted) {
                bgr.release();
            }
        }
    }

    /**
     * Build a new CV_8UC3 Mat holding the active region of a buffer.
     * Caller releases the Mat.
     */
    public static Mat toMat(PixelBuffer buffer) {
        Mat mat = new Mat(buffer.rows(), buffer.cols(), CvType.CV_8UC3);
        if (buffer.rows() > 0 && buffer.cols() > 0) {
            mat.put(0, 0, buffer.packActive());
        }
        return mat;
    }

    /**
     * Write an 8-bit 3-channel Mat into the active region of an existing buffer.
     *
     * @throws ShapeMismatchException if the Mat's size or type does not match
     */
    public static void copyInto(Mat mat, PixelBuffer destination) {
        if (mat.type() != CvType.CV_8UC3) {
            throw new ShapeMismatchException("Expected CV_8UC3, got " + CvType.typeToString(mat.type()));
        }
        if (mat.rows() != destination.rows() || mat.cols() != destination.cols()) {
            throw new ShapeMismatchException("Mat is " + mat.cols() + "x" + mat.rows()
                    + " but destination is " + destination.describe());
        }
        byte[] packed = new byte[destination.activeRowBytes() * destination.rows()];
        mat.get(0, 0, packed);
        destination.unpackActive(packed);
    }
}
