package com.ttennebkram.videofft.model;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * One decoded frame's brightness channel as a height x width grid of samples.
 * Samples are stored row-major; the grid is not copied on read, callers must not mutate it.
 */
public class LuminanceFrame {

    private final int height;
    private final int width;
    private final double[] samples;

    public LuminanceFrame(int height, int width, double[] samples) {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Negative frame dimensions: " + height + "x" + width);
        }
        if (samples == null || samples.length != height * width) {
            throw new IllegalArgumentException("Sample count does not match " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        this.samples = samples;
    }

    /**
     * Build a frame from a rectangular array of rows.
     */
    public static LuminanceFrame of(double[][] rows) {
        int h = rows.length;
        int w = h == 0 ? 0 : rows[0].length;
        double[] data = new double[h * w];
        for (int y = 0; y < h; y++) {
            if (rows[y].length != w) {
                throw new IllegalArgumentException("Ragged row " + y + ": expected " + w + " samples");
            }
            System.arraycopy(rows[y], 0, data, y * w, w);
        }
        return new LuminanceFrame(h, w, data);
    }

    /**
     * Copy a single-channel Mat of any depth into a frame.
     */
    public static LuminanceFrame fromMat(Mat mat) {
        if (mat.channels() != 1) {
            throw new IllegalArgumentException("Expected a single-channel Mat, got " + mat.channels() + " channels");
        }
        Mat doubles = new Mat();
        try {
            mat.convertTo(doubles, CvType.CV_64F);
            double[] data = new double[mat.rows() * mat.cols()];
            if (data.length > 0) {
                doubles.get(0, 0, data);
            }
            return new LuminanceFrame(mat.rows(), mat.cols(), data);
        } finally {
            doubles.release();
        }
    }

    /**
     * Copy this frame into a new CV_64FC1 Mat (caller must release).
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, CvType.CV_64FC1);
        if (samples.length > 0) {
            mat.put(0, 0, samples);
        }
        return mat;
    }

    public int getHeight() { return height; }
    public int getWidth() { return width; }

    public boolean isEmpty() {
        return height == 0 || width == 0;
    }

    public double get(int y, int x) {
        return samples[y * width + x];
    }

    public double[] getSamples() {
        return samples;
    }

    /**
     * Sum of all samples; equals the DC term of the frame's Fourier transform.
     */
    public double sum() {
        double total = 0;
        for (double s : samples) {
            total += s;
        }
        return total;
    }

    @Override
    public String toString() {
        return "LuminanceFrame[" + height + "x" + width + "]";
    }
}
