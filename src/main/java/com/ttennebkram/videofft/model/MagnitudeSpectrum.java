package com.ttennebkram.videofft.model;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Centered 2D Fourier magnitude of a frame. The DC term sits at (height / 2, width / 2).
 * When {@code logScaled} is set the values are log(1 + |F|), otherwise the raw magnitude.
 */
public class MagnitudeSpectrum {

    private final int height;
    private final int width;
    private final double[] values;
    private final boolean logScaled;

    public MagnitudeSpectrum(int height, int width, double[] values, boolean logScaled) {
        if (values == null || values.length != height * width) {
            throw new IllegalArgumentException("Value count does not match " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        this.values = values;
        this.logScaled = logScaled;
    }

    public static MagnitudeSpectrum fromMat(Mat mat, boolean logScaled) {
        Mat doubles = new Mat();
        try {
            mat.convertTo(doubles, CvType.CV_64F);
            double[] data = new double[mat.rows() * mat.cols()];
            if (data.length > 0) {
                doubles.get(0, 0, data);
            }
            return new MagnitudeSpectrum(mat.rows(), mat.cols(), data, logScaled);
        } finally {
            doubles.release();
        }
    }

    /**
     * Copy into a new CV_64FC1 Mat (caller must release).
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, CvType.CV_64FC1);
        if (values.length > 0) {
            mat.put(0, 0, values);
        }
        return mat;
    }

    public int getHeight() { return height; }
    public int getWidth() { return width; }
    public boolean isLogScaled() { return logScaled; }

    public int getCenterRow() { return height / 2; }
    public int getCenterCol() { return width / 2; }

    public double get(int y, int x) {
        return values[y * width + x];
    }

    public double getDc() {
        return get(getCenterRow(), getCenterCol());
    }

    public double[] getValues() {
        return values;
    }
}
