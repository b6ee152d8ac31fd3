package com.ttennebkram.videofft.render;

import com.ttennebkram.videofft.TestFrames;
import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import com.ttennebkram.videofft.model.RadialProfile;
import com.ttennebkram.videofft.processing.FrameSpectrum;
import com.ttennebkram.videofft.processing.RadialProfiler;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumImageWriterTest {

    @TempDir
    Path tempDir;

    private MagnitudeSpectrum spectrum;
    private RadialProfile profile;

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    private void computeSpectrum() {
        spectrum = new FrameSpectrum().compute(TestFrames.noise(24, 32, 3));
        profile = new RadialProfiler().radialProfile(spectrum);
    }

    @Test
    void testPrefixFromInputBaseName() throws IOException {
        Path out = tempDir.resolve("images");
        SpectrumImageWriter writer = SpectrumImageWriter.create(out.toString(), "/videos/clip.final.mp4", 1.0);
        assertEquals(out.resolve("clip.final").toString(), writer.getFilePrefix());
        assertTrue(Files.isDirectory(out));
    }

    @Test
    void testDefaultsToInputDirectory() throws IOException {
        Path input = tempDir.resolve("movie.avi");
        SpectrumImageWriter writer = SpectrumImageWriter.create(null, input.toString(), 1.0);
        assertEquals(tempDir.resolve("movie").toString(), writer.getFilePrefix());
    }

    @Test
    void testRejectsBadScale() {
        assertThrows(IllegalArgumentException.class,
            () -> SpectrumImageWriter.create(tempDir.toString(), "clip.mp4", 0));
    }

    @Test
    void testFrameImages() throws IOException {
        computeSpectrum();
        SpectrumImageWriter writer = SpectrumImageWriter.create(tempDir.toString(), "clip.mp4", 1.0);
        writer.renderFrame(0, spectrum, profile);

        Path image = tempDir.resolve("clip_frame-0.png");
        Path plot = tempDir.resolve("clip_frame-0-profile.png");
        assertEquals(Arrays.asList(image.toString(), plot.toString()), writer.getWrittenFiles());

        Mat written = Imgcodecs.imread(image.toString(), Imgcodecs.IMREAD_UNCHANGED);
        assertEquals(24, written.rows());
        assertEquals(32, written.cols());
        assertEquals(1, written.channels());
        written.release();
        assertTrue(Files.size(plot) > 0);
    }

    @Test
    void testMeanImagesScaled() throws IOException {
        computeSpectrum();
        SpectrumImageWriter writer = SpectrumImageWriter.create(tempDir.toString(), "clip.mp4", 2.0);
        writer.renderMean(spectrum, profile);

        Mat written = Imgcodecs.imread(tempDir.resolve("clip-mean.png").toString(), Imgcodecs.IMREAD_UNCHANGED);
        assertEquals(48, written.rows());
        assertEquals(64, written.cols());
        written.release();

        Mat plot = Imgcodecs.imread(tempDir.resolve("clip-mean-profile.png").toString());
        assertEquals(720, plot.rows());
        assertEquals(1280, plot.cols());
        plot.release();
    }
}
