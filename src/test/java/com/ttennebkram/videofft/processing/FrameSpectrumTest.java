package com.ttennebkram.videofft.processing;

import com.ttennebkram.videofft.TestFrames;
import com.ttennebkram.videofft.model.LuminanceFrame;
import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class FrameSpectrumTest {

    private final FrameSpectrum frameSpectrum = new FrameSpectrum();

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void testOutputMatchesInputDimensions() {
        for (int[] dims : new int[][]{{8, 8}, {7, 5}, {6, 9}, {1, 12}, {13, 1}}) {
            LuminanceFrame frame = TestFrames.noise(dims[0], dims[1], 7);
            MagnitudeSpectrum spectrum = frameSpectrum.compute(frame);
            assertEquals(dims[0], spectrum.getHeight());
            assertEquals(dims[1], spectrum.getWidth());
            assertTrue(spectrum.isLogScaled());
        }
    }

    @Test
    void testDcEqualsSampleSumAtCenterEvenSize() {
        LuminanceFrame frame = TestFrames.noise(6, 8, 11);
        MagnitudeSpectrum magnitude = frameSpectrum.magnitude(frame);

        assertFalse(magnitude.isLogScaled());
        assertEquals(frame.sum(), magnitude.get(3, 4), 1e-6);
        assertEquals(frame.sum(), magnitude.getDc(), 1e-6);
    }

    @Test
    void testDcEqualsSampleSumAtCenterOddSize() {
        LuminanceFrame frame = TestFrames.noise(7, 9, 12);
        MagnitudeSpectrum magnitude = frameSpectrum.magnitude(frame);

        assertEquals(frame.sum(), magnitude.get(3, 4), 1e-6);
        // DC is the largest magnitude for non-negative input
        double dc = magnitude.get(3, 4);
        for (double v : magnitude.getValues()) {
            assertTrue(v <= dc + 1e-9);
        }
    }

    @Test
    void testConstantFrameHasEnergyOnlyAtDc() {
        LuminanceFrame frame = TestFrames.constant(5, 4, 10.0);
        MagnitudeSpectrum magnitude = frameSpectrum.magnitude(frame);

        for (int y = 0; y < 5; y++) {
            for (int x = 0; x < 4; x++) {
                double expected = (y == 2 && x == 2) ? 200.0 : 0.0;
                assertEquals(expected, magnitude.get(y, x), 1e-9, "at " + y + "," + x);
            }
        }
    }

    @Test
    void testRawMagnitudeIsPointSymmetricAboutCenter() {
        for (int[] dims : new int[][]{{9, 7}, {8, 10}, {6, 5}}) {
            int h = dims[0];
            int w = dims[1];
            MagnitudeSpectrum magnitude = frameSpectrum.magnitude(TestFrames.noise(h, w, 21));
            int cy = h / 2;
            int cx = w / 2;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int my = Math.floorMod(2 * cy - y, h);
                    int mx = Math.floorMod(2 * cx - x, w);
                    assertEquals(magnitude.get(y, x), magnitude.get(my, mx), 1e-6,
                        h + "x" + w + " at " + y + "," + x);
                }
            }
        }
    }

    @Test
    void testComputeIsLog1pOfMagnitude() {
        LuminanceFrame frame = TestFrames.noise(8, 6, 3);
        MagnitudeSpectrum raw = frameSpectrum.magnitude(frame);
        MagnitudeSpectrum logged = frameSpectrum.compute(frame);

        for (int i = 0; i < raw.getValues().length; i++) {
            assertEquals(Math.log1p(raw.getValues()[i]), logged.getValues()[i], 1e-9);
            assertTrue(logged.getValues()[i] >= 0.0);
        }
    }

    @Test
    void testZeroFrameGivesZeroSpectrum() {
        MagnitudeSpectrum spectrum = frameSpectrum.compute(TestFrames.constant(4, 4, 0.0));
        for (double v : spectrum.getValues()) {
            assertEquals(0.0, v, 1e-12);
        }
    }

    @Test
    void testEmptyFrameRejected() {
        LuminanceFrame empty = new LuminanceFrame(0, 5, new double[0]);
        assertThrows(InvalidFrameException.class, () -> frameSpectrum.compute(empty));
        assertThrows(InvalidFrameException.class, () -> frameSpectrum.compute(null));
    }

    @Test
    void testNonFiniteSamplesRejected() {
        LuminanceFrame base = TestFrames.noise(4, 4, 5);
        InvalidFrameException nan = assertThrows(InvalidFrameException.class,
            () -> frameSpectrum.compute(TestFrames.withSample(base, 1, 2, Double.NaN)));
        assertFalse(nan.hasFrameIndex());
        assertThrows(InvalidFrameException.class,
            () -> frameSpectrum.compute(TestFrames.withSample(base, 0, 0, Double.POSITIVE_INFINITY)));
    }

    @Test
    void testFftShiftRollsOddAndEvenAxes() {
        Mat input = new Mat(3, 4, CvType.CV_64FC1);
        input.put(0, 0,
            0, 1, 2, 3,
            4, 5, 6, 7,
            8, 9, 10, 11);
        Mat shifted = FrameSpectrum.fftShift(input);
        double[] out = new double[12];
        shifted.get(0, 0, out);

        // rows rolled by 1, columns rolled by 2
        assertArrayEquals(new double[]{
            10, 11, 8, 9,
            2, 3, 0, 1,
            6, 7, 4, 5}, out, 0.0);
        input.release();
        shifted.release();
    }
}
