package com.ttennebkram.videofft.source;

import com.ttennebkram.videofft.model.LuminanceFrame;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Grayscale conversion of decoded BGR/BGRA images.
 */
final class Luminance {

    private Luminance() {
    }

    static LuminanceFrame of(Mat image) {
        if (image.channels() == 1) {
            return LuminanceFrame.fromMat(image);
        }
        Mat gray = new Mat();
        try {
            int code = image.channels() == 4 ? Imgproc.COLOR_BGRA2GRAY : Imgproc.COLOR_BGR2GRAY;
            Imgproc.cvtColor(image, gray, code);
            return LuminanceFrame.fromMat(gray);
        } finally {
            gray.release();
        }
    }
}
