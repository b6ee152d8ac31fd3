package com.ttennebkram.videofft.source;

import com.ttennebkram.videofft.model.LuminanceFrame;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.File;
import java.io.IOException;

/**
 * A still image as a one-frame sequence.
 */
public class ImageFrameSource implements FrameSource {

    private final String path;
    private LuminanceFrame frame;

    private ImageFrameSource(String path, LuminanceFrame frame) {
        this.path = path;
        this.frame = frame;
    }

    public static ImageFrameSource open(String path) throws IOException {
        Mat image = Imgcodecs.imread(path, Imgcodecs.IMREAD_GRAYSCALE);
        try {
            if (image.empty()) {
                throw new IOException("Could not read image " + path);
            }
            return new ImageFrameSource(path, Luminance.of(image));
        } finally {
            image.release();
        }
    }

    @Override
    public LuminanceFrame nextFrame() {
        LuminanceFrame next = frame;
        frame = null;
        return next;
    }

    @Override
    public int frameCountHint() {
        return 1;
    }

    @Override
    public String describe() {
        return new File(path).getAbsolutePath();
    }
}
