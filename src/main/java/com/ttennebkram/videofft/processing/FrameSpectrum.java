package com.ttennebkram.videofft.processing;

import com.ttennebkram.videofft.model.LuminanceFrame;
import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

/**
 * Centered, log-compressed 2D Fourier magnitude of a luminance frame.
 * Core.dft() on the unpadded grid, so the spectrum has exactly the frame's dimensions.
 * Stateless; one instance can be shared between threads.
 */
public class FrameSpectrum {

    /**
     * log(1 + |F|) of the frame, DC moved to (height / 2, width / 2).
     */
    public MagnitudeSpectrum compute(LuminanceFrame frame) {
        Mat magnitude = centeredMagnitude(frame);
        try {
            Core.add(magnitude, Scalar.all(1.0), magnitude);
            Core.log(magnitude, magnitude);
            return MagnitudeSpectrum.fromMat(magnitude, true);
        } finally {
            magnitude.release();
        }
    }

    /**
     * Raw |F| of the frame, DC moved to (height / 2, width / 2).
     */
    public MagnitudeSpectrum magnitude(LuminanceFrame frame) {
        Mat magnitude = centeredMagnitude(frame);
        try {
            return MagnitudeSpectrum.fromMat(magnitude, false);
        } finally {
            magnitude.release();
        }
    }

    private Mat centeredMagnitude(LuminanceFrame frame) {
        validate(frame);

        Mat real = frame.toMat();
        Mat complexI = new Mat();
        try {
            if (!Core.checkRange(real, true)) {
                throw new InvalidFrameException("Frame contains NaN or infinite samples");
            }
            List<Mat> planes = new ArrayList<>();
            planes.add(real);
            planes.add(Mat.zeros(real.size(), CvType.CV_64F));
            Core.merge(planes, complexI);
            planes.get(1).release();

            Core.dft(complexI, complexI, Core.DFT_COMPLEX_OUTPUT);

            List<Mat> dftPlanes = new ArrayList<>();
            Core.split(complexI, dftPlanes);
            Mat magnitude = new Mat();
            try {
                Core.magnitude(dftPlanes.get(0), dftPlanes.get(1), magnitude);
            } finally {
                for (Mat p : dftPlanes) p.release();
            }

            Mat shifted = fftShift(magnitude);
            magnitude.release();
            return shifted;
        } finally {
            real.release();
            complexI.release();
        }
    }

    private static void validate(LuminanceFrame frame) {
        if (frame == null) {
            throw new InvalidFrameException("Frame is missing");
        }
        if (frame.isEmpty()) {
            throw new InvalidFrameException("Frame is empty (" + frame.getHeight() + "x" + frame.getWidth() + ")");
        }
    }

    /**
     * Roll the grid by (rows / 2, cols / 2) so the zero frequency lands in the center.
     * Works for odd sizes too: index 0 moves to index n / 2 along each axis.
     * Returns a new Mat; the input is left untouched.
     */
    static Mat fftShift(Mat input) {
        int rows = input.rows();
        int cols = input.cols();
        int cy = rows / 2;
        int cx = cols / 2;
        // sizes of the leading (top/left) blocks
        int ry = rows - cy;
        int rx = cols - cx;

        Mat output = new Mat(input.size(), input.type());
        copyBlock(input, output, 0, 0, cy, cx, ry, rx);      // top-left -> bottom-right
        copyBlock(input, output, 0, rx, cy, 0, ry, cx);      // top-right -> bottom-left
        copyBlock(input, output, ry, 0, 0, cx, cy, rx);      // bottom-left -> top-right
        copyBlock(input, output, ry, rx, 0, 0, cy, cx);      // bottom-right -> top-left
        return output;
    }

    private static void copyBlock(Mat src, Mat dst, int srcRow, int srcCol,
                                  int dstRow, int dstCol, int height, int width) {
        if (height <= 0 || width <= 0) {
            return;
        }
        Mat from = new Mat(src, new Rect(srcCol, srcRow, width, height));
        Mat to = new Mat(dst, new Rect(dstCol, dstRow, width, height));
        from.copyTo(to);
        from.release();
        to.release();
    }
}
