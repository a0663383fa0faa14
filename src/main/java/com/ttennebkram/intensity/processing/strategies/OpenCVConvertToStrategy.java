package com.ttennebkram.intensity.processing.strategies;

import com.ttennebkram.intensity.model.PixelBuffer;
import com.ttennebkram.intensity.processing.StrategyInfo;
import com.ttennebkram.intensity.processing.TransformStrategyBase;
import com.ttennebkram.intensity.util.MatBuffers;
import com.ttennebkram.intensity.util.OpenCVLoader;
import org.opencv.core.Mat;

/**
 * Reference strategy backed by OpenCV.
 * Mat.convertTo(dst, -1, scale, offset)
 *
 * OpenCV computes in single precision and rounds half to even before saturating, so
 * results can be one level away from the lookup strategies on ties. It is kept as a
 * reference and for timing comparisons, not as the definition of correct output.
 */
@StrategyInfo(
    name = OpenCVConvertToStrategy.NAME,
    description = "OpenCV reference\nMat.convertTo(dst, -1, scale, offset)",
    reference = true
)
public class OpenCVConvertToStrategy extends TransformStrategyBase {

    public static final String NAME = "OpenCV::convertTo";

    @Override
    protected void transform(PixelBuffer source, PixelBuffer destination, double scale, double offset) {
        OpenCVLoader.ensureLoaded();

        Mat input = MatBuffers.toMat(source);
        Mat output = new Mat();
        try {
            input.convertTo(output, -1, scale, offset);
            MatBuffers.copyInto(output, destination);
        } finally {
            input.release();
            output.release();
        }
    }
}
