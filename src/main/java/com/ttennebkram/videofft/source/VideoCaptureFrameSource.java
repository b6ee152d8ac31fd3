package com.ttennebkram.videofft.source;

import com.ttennebkram.videofft.model.LuminanceFrame;
import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;

import java.io.File;
import java.io.IOException;

/**
 * Decodes a video file with OpenCV's VideoCapture and yields the luminance of each frame.
 * Frames are decoded lazily, one per {@link #nextFrame()} call.
 */
public class VideoCaptureFrameSource implements FrameSource {

    private final String path;
    private final VideoCapture videoCapture;
    private final int frameCount;
    private int framesRead = 0;
    private boolean exhausted = false;

    private VideoCaptureFrameSource(String path, VideoCapture videoCapture) {
        this.path = path;
        this.videoCapture = videoCapture;
        double count = videoCapture.get(Videoio.CAP_PROP_FRAME_COUNT);
        this.frameCount = count > 0 ? (int) count : UNKNOWN_COUNT;
        if (frameCount == UNKNOWN_COUNT) {
            System.err.println("[VideoCaptureFrameSource] WARNING: container of " + path
                + " does not report a frame count");
        }
    }

    public static VideoCaptureFrameSource open(String path) throws IOException {
        if (!new File(path).isFile()) {
            throw new IOException("Input file not found: " + path);
        }
        VideoCapture capture = new VideoCapture(path);
        if (!capture.isOpened()) {
            capture.release();
            throw new IOException("No video streams found in " + path);
        }
        return new VideoCaptureFrameSource(path, capture);
    }

    @Override
    public LuminanceFrame nextFrame() {
        if (exhausted) {
            return null;
        }
        Mat frame = new Mat();
        try {
            if (!videoCapture.read(frame) || frame.empty()) {
                exhausted = true;
                if (endedEarly(framesRead, frameCount)) {
                    System.err.println("[VideoCaptureFrameSource] WARNING: " + path + " stopped decoding after "
                        + framesRead + " of " + frameCount + " frames");
                }
                return null;
            }
            framesRead++;
            return Luminance.of(frame);
        } finally {
            frame.release();
        }
    }

    /**
     * True when decoding stopped before the frame count the container reported.
     */
    static boolean endedEarly(int framesRead, int frameCount) {
        return frameCount != UNKNOWN_COUNT && framesRead < frameCount;
    }

    @Override
    public int frameCountHint() {
        return frameCount;
    }

    @Override
    public String describe() {
        return new File(path).getAbsolutePath();
    }

    @Override
    public void close() {
        videoCapture.release();
    }
}
