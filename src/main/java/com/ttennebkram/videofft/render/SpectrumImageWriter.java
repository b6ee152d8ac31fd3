package com.ttennebkram.videofft.render;

import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import com.ttennebkram.videofft.model.RadialProfile;
import com.ttennebkram.videofft.processing.RadialProfiler;
import com.ttennebkram.videofft.processing.SpectrumRenderer;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes spectra as grayscale PNGs and radial profiles as line plots.
 *
 * File names follow {@code <prefix>_frame-<i>.png} for single frames and
 * {@code <prefix>-mean.png} for the sequence mean, each with a matching
 * {@code -profile.png} plot.
 */
public class SpectrumImageWriter implements SpectrumRenderer {

    private static final int PLOT_WIDTH = 640;
    private static final int PLOT_HEIGHT = 360;
    private static final int AXIS_HEIGHT = 30;
    private static final int MARGIN = 10;
    private static final Scalar BACKGROUND = new Scalar(255, 255, 255);
    private static final Scalar AXIS_COLOR = new Scalar(0, 0, 0);
    private static final Scalar LINE_COLOR = new Scalar(200, 80, 0);
    private static final Scalar BAND_COLOR = new Scalar(160, 160, 160);

    private final String filePrefix;
    private final double scale;
    private final List<String> writtenFiles = new ArrayList<>();

    private SpectrumImageWriter(String filePrefix, double scale) {
        this.filePrefix = filePrefix;
        this.scale = scale;
    }

    /**
     * @param outputDirectory directory for the images, created if missing; null means the input's directory
     * @param inputFile       input whose base name (without extension) prefixes every file
     * @param scale           image scale factor, 1.0 keeps the spectrum's pixel size
     */
    public static SpectrumImageWriter create(String outputDirectory, String inputFile, double scale) throws IOException {
        if (!(scale > 0)) {
            throw new IllegalArgumentException("Image scale must be positive: " + scale);
        }
        File input = new File(inputFile);
        String dir = outputDirectory;
        if (dir == null) {
            File parent = input.getAbsoluteFile().getParentFile();
            dir = parent != null ? parent.getPath() : ".";
        }
        Path outDir = Paths.get(dir);
        Files.createDirectories(outDir);

        String baseName = input.getName();
        int dot = baseName.lastIndexOf('.');
        if (dot > 0) {
            baseName = baseName.substring(0, dot);
        }
        return new SpectrumImageWriter(outDir.resolve(baseName).toString(), scale);
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    /**
     * Paths written so far, in write order.
     */
    public List<String> getWrittenFiles() {
        return Collections.unmodifiableList(writtenFiles);
    }

    @Override
    public void renderFrame(int frameIndex, MagnitudeSpectrum spectrum, RadialProfile profile) {
        String base = filePrefix + "_frame-" + frameIndex;
        writeSpectrum(spectrum, base + ".png");
        writeProfile(profile, base + "-profile.png");
    }

    @Override
    public void renderMean(MagnitudeSpectrum meanSpectrum, RadialProfile meanProfile) {
        String base = filePrefix + "-mean";
        writeSpectrum(meanSpectrum, base + ".png");
        writeProfile(meanProfile, base + "-profile.png");
    }

    void writeSpectrum(MagnitudeSpectrum spectrum, String path) {
        Mat values = spectrum.toMat();
        Mat image = new Mat();
        try {
            Core.normalize(values, image, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);
            if (scale != 1.0) {
                Size size = new Size(
                    Math.max(1, Math.round(image.cols() * scale)),
                    Math.max(1, Math.round(image.rows() * scale)));
                Imgproc.resize(image, image, size, 0, 0,
                    scale < 1.0 ? Imgproc.INTER_AREA : Imgproc.INTER_NEAREST);
            }
            write(path, image);
        } finally {
            values.release();
            image.release();
        }
    }

    void writeProfile(RadialProfile profile, String path) {
        int width = (int) Math.max(PLOT_WIDTH / 4, Math.round(PLOT_WIDTH * scale));
        int height = (int) Math.max(PLOT_HEIGHT / 4, Math.round(PLOT_HEIGHT * scale));
        Mat plot = new Mat(height, width, CvType.CV_8UC3, BACKGROUND);
        try {
            drawProfile(plot, profile);
            drawAxis(plot, profile.getMaxRadius());
            write(path, plot);
        } finally {
            plot.release();
        }
    }

    private void drawProfile(Mat plot, RadialProfile profile) {
        int width = plot.cols();
        int plotBottom = plot.rows() - AXIS_HEIGHT;
        int plotHeight = plotBottom - MARGIN;
        int maxRadius = profile.getMaxRadius();

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (int r = 0; r <= maxRadius; r++) {
            min = Math.min(min, profile.get(r));
            max = Math.max(max, profile.get(r));
        }
        double range = max - min;

        // High-frequency band boundary
        int bandX = xFor(RadialProfiler.highFrequencyStart(maxRadius), maxRadius, width);
        Imgproc.line(plot, new Point(bandX, MARGIN), new Point(bandX, plotBottom), BAND_COLOR, 1);

        int thickness = Math.max(1, (int) Math.round(2 * scale));
        Point previous = null;
        for (int r = 0; r <= maxRadius; r++) {
            double norm = range > 0 ? (profile.get(r) - min) / range : 0.5;
            Point current = new Point(xFor(r, maxRadius, width), plotBottom - norm * plotHeight);
            if (previous != null) {
                Imgproc.line(plot, previous, current, LINE_COLOR, thickness);
            }
            previous = current;
        }
    }

    private void drawAxis(Mat plot, int maxRadius) {
        int width = plot.cols();
        int height = plot.rows();
        double fontScale = Math.max(0.4, width / 1600.0);
        int thickness = Math.max(1, (int) (width / 800.0));

        Imgproc.line(plot,
            new Point(0, height - AXIS_HEIGHT),
            new Point(width, height - AXIS_HEIGHT),
            AXIS_COLOR, 2);

        int numTicks = Math.min(8, maxRadius);
        for (int i = 0; i <= numTicks; i++) {
            int radius = (i * maxRadius) / numTicks;
            int x = xFor(radius, maxRadius, width);
            Imgproc.line(plot,
                new Point(x, height - AXIS_HEIGHT),
                new Point(x, height - AXIS_HEIGHT + 8),
                AXIS_COLOR, 2);

            String label = String.valueOf(radius);
            int textWidth = (int) (label.length() * 10 * fontScale);
            int textX = Math.max(0, Math.min(width - textWidth, x - textWidth / 2));
            Imgproc.putText(plot, label,
                new Point(textX, height - 8),
                Imgproc.FONT_HERSHEY_SIMPLEX, fontScale,
                AXIS_COLOR, thickness);
        }
    }

    private static int xFor(int radius, int maxRadius, int width) {
        int usable = width - 2 * MARGIN;
        return MARGIN + (int) Math.round((double) radius * usable / Math.max(1, maxRadius));
    }

    private void write(String path, Mat image) {
        if (!Imgcodecs.imwrite(path, image)) {
            throw new UncheckedIOException(new IOException("Could not write image " + path));
        }
        writtenFiles.add(path);
        System.err.println("[SpectrumImageWriter] File written to " + path);
    }
}
