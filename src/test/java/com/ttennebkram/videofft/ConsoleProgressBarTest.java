package com.ttennebkram.videofft;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleProgressBarTest {

    @Test
    void testKnownTotal() {
        assertEquals(" 50%|###############               | 5/10 [2.0s, 2.50 frames/s]",
            ConsoleProgressBar.render(5, 10, 2000));
        assertEquals("  0%|                              | 0/4 [0.0s, 0.00 frames/s]",
            ConsoleProgressBar.render(0, 4, 0));
    }

    @Test
    void testBarNeverOverflows() {
        String line = ConsoleProgressBar.render(12, 10, 1000);
        assertTrue(line.startsWith("100%|##############################| 10/10"), line);
    }

    @Test
    void testUnknownTotal() {
        assertEquals("3 frames [1.5s, 2.00 frames/s]", ConsoleProgressBar.render(3, -1, 1500));
    }

    @Test
    void testRedrawsInPlace() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ConsoleProgressBar bar = new ConsoleProgressBar(new PrintStream(bytes, true));
        bar.frameCompleted(0, 2);
        bar.frameCompleted(1, 2);
        bar.finished();

        String text = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(text.startsWith("\r 50%"), text);
        assertTrue(text.contains("\r100%"), text);
        assertTrue(text.endsWith(System.lineSeparator()));
    }

    @Test
    void testFinishedWithoutFramesPrintsNothing() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new ConsoleProgressBar(new PrintStream(bytes, true)).finished();
        assertEquals(0, bytes.size());
    }
}
