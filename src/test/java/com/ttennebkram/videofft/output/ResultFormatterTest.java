package com.ttennebkram.videofft.output;

import com.ttennebkram.videofft.model.FrameResult;
import com.ttennebkram.videofft.model.RadialProfile;
import com.ttennebkram.videofft.model.SequenceResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatterTest {

    static SequenceResult sample() {
        return SequenceResult.of(Arrays.asList(
            new FrameResult(0, new RadialProfile(new double[]{4.0, 2.0, 1.0}), 3.0),
            new FrameResult(1, new RadialProfile(new double[]{6.0, 4.0, 3.0}), 7.0),
            new FrameResult(2, new RadialProfile(new double[]{5.0, 3.0, 2.0}), 5.0)));
    }

    @Test
    void testProjection() {
        SequenceResult result = sample();
        AnalysisReport report = ResultFormatter.format(result, "/videos/clip.mp4");

        assertEquals("/videos/clip.mp4", report.getInputFile());
        assertEquals(3, report.getFrameCount());
        assertEquals(result.getMeanHighFrequencyScore(), report.getMeanHighFrequencyScore());
        assertEquals(5.0, report.getMeanHighFrequencyScore(), 1e-12);
        assertEquals(7.0, report.getMaxHighFrequencyScore());
        assertEquals(3.0, report.getMinHighFrequencyScore());
        assertEquals(5.0, report.getMedianHighFrequencyScore());
        assertArrayEquals(new double[]{5.0, 3.0, 2.0}, report.getMeanRadialProfile(), 1e-12);
    }

    @Test
    void testPerFrameOrder() {
        AnalysisReport report = ResultFormatter.format(sample());
        assertNull(report.getInputFile());
        assertEquals(3, report.getPerFrame().size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i, report.getPerFrame().get(i).frameIndex);
        }
        assertEquals(7.0, report.getPerFrame().get(1).highFrequencyScore);
    }

    @Test
    void testFormattingIsRepeatable() {
        SequenceResult result = sample();
        String first = new JsonReportEncoder().encode(ResultFormatter.format(result, "a.mp4"));
        String second = new JsonReportEncoder().encode(ResultFormatter.format(result, "a.mp4"));
        assertEquals(first, second);
    }

    @Test
    void testOutputFormatFromName() {
        assertEquals(OutputFormat.JSON, OutputFormat.fromName("json"));
        assertEquals(OutputFormat.CSV, OutputFormat.fromName("CSV"));
        assertTrue(OutputFormat.CSV.encoder() instanceof CsvReportEncoder);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> OutputFormat.fromName("yaml"));
        assertTrue(e.getMessage().contains("'yaml'"));
    }
}
