package com.ttennebkram.videofft.model;

import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class LuminanceFrameTest {

    @Test
    void testOfRows() {
        LuminanceFrame frame = LuminanceFrame.of(new double[][]{{1, 2, 3}, {4, 5, 6}});
        assertEquals(2, frame.getHeight());
        assertEquals(3, frame.getWidth());
        assertEquals(6.0, frame.get(1, 2));
        assertEquals(21.0, frame.sum());
        assertFalse(frame.isEmpty());
    }

    @Test
    void testRejectsMalformedGrids() {
        assertThrows(IllegalArgumentException.class, () -> new LuminanceFrame(2, 2, new double[3]));
        assertThrows(IllegalArgumentException.class, () -> new LuminanceFrame(-1, 2, new double[0]));
        assertThrows(IllegalArgumentException.class,
            () -> LuminanceFrame.of(new double[][]{{1, 2}, {3}}));
    }

    @Test
    void testEmpty() {
        assertTrue(new LuminanceFrame(0, 5, new double[0]).isEmpty());
        assertTrue(LuminanceFrame.of(new double[0][]).isEmpty());
    }

    @Test
    void testMatRoundTripKeepsLayout() {
        nu.pattern.OpenCV.loadLocally();
        Mat bytes = new Mat(2, 3, CvType.CV_8UC1);
        bytes.put(0, 0, new byte[]{0, 10, 20, 30, 40, (byte) 250});
        LuminanceFrame frame = LuminanceFrame.fromMat(bytes);
        bytes.release();

        assertEquals(10.0, frame.get(0, 1));
        assertEquals(30.0, frame.get(1, 0));
        assertEquals(250.0, frame.get(1, 2));

        Mat doubles = frame.toMat();
        assertEquals(CvType.CV_64FC1, doubles.type());
        assertEquals(40.0, doubles.get(1, 1)[0]);
        doubles.release();

        Mat color = new Mat(2, 2, CvType.CV_8UC3);
        assertThrows(IllegalArgumentException.class, () -> LuminanceFrame.fromMat(color));
        color.release();
    }
}
