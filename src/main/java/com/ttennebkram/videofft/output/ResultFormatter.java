package com.ttennebkram.videofft.output;

import com.ttennebkram.videofft.model.FrameResult;
import com.ttennebkram.videofft.model.ScoreStatistics;
import com.ttennebkram.videofft.model.SequenceResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a SequenceResult onto the flat report record. No values are recomputed.
 */
public final class ResultFormatter {

    private ResultFormatter() {
    }

    public static AnalysisReport format(SequenceResult result) {
        return format(result, null);
    }

    public static AnalysisReport format(SequenceResult result, String inputFile) {
        List<AnalysisReport.FrameScore> perFrame = new ArrayList<>(result.getFrameCount());
        for (FrameResult fr : result.getFrameResults()) {
            perFrame.add(new AnalysisReport.FrameScore(fr.getFrameIndex(), fr.getHighFrequencyScore()));
        }
        ScoreStatistics stats = result.getStatistics();
        return new AnalysisReport(
            inputFile,
            result.getFrameCount(),
            result.getMeanHighFrequencyScore(),
            stats.getMax(),
            stats.getMin(),
            stats.getMedian(),
            stats.getPct05(),
            stats.getPct95(),
            perFrame,
            result.getMeanRadialProfile().toArray());
    }
}
