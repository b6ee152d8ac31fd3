package com.ttennebkram.videofft.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class SequenceResultTest {

    @Test
    void testMeanProfileAndScore() {
        SequenceResult result = SequenceResult.of(Arrays.asList(
            new FrameResult(0, new RadialProfile(new double[]{1.0, 2.0, 3.0}), 2.0),
            new FrameResult(1, new RadialProfile(new double[]{3.0, 4.0, 5.0}), 4.0),
            new FrameResult(2, new RadialProfile(new double[]{5.0, 6.0, 7.0}), 6.0)));

        assertEquals(3, result.getFrameCount());
        assertEquals(4.0, result.getMeanHighFrequencyScore());
        assertArrayEquals(new double[]{3.0, 4.0, 5.0}, result.getMeanRadialProfile().toArray(), 1e-12);
        assertEquals(2.0, result.getStatistics().getMin());
        assertEquals(6.0, result.getStatistics().getMax());
    }

    @Test
    void testFrameResultsKeepOrderAndAreReadOnly() {
        SequenceResult result = SequenceResult.of(Arrays.asList(
            new FrameResult(0, new RadialProfile(new double[]{1.0, 1.0}), 1.0),
            new FrameResult(1, new RadialProfile(new double[]{1.0, 1.0}), 1.0)));

        assertEquals(0, result.getFrameResults().get(0).getFrameIndex());
        assertEquals(1, result.getFrameResults().get(1).getFrameIndex());
        assertThrows(UnsupportedOperationException.class, () -> result.getFrameResults().clear());
    }

    @Test
    void testMismatchedProfileLengthsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SequenceResult.of(Arrays.asList(
            new FrameResult(0, new RadialProfile(new double[]{1.0, 1.0}), 1.0),
            new FrameResult(1, new RadialProfile(new double[]{1.0, 1.0, 1.0}), 1.0))));
    }

    @Test
    void testEmptyRejected() {
        assertThrows(IllegalArgumentException.class, () -> SequenceResult.of(Collections.emptyList()));
    }
}
