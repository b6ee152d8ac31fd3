package com.ttennebkram.videofft.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate over every processed frame of one run. Built once, after the last frame.
 */
public class SequenceResult {

    private final List<FrameResult> frameResults;
    private final RadialProfile meanRadialProfile;
    private final double meanHighFrequencyScore;
    private final ScoreStatistics statistics;

    private SequenceResult(List<FrameResult> frameResults, RadialProfile meanRadialProfile,
                           double meanHighFrequencyScore, ScoreStatistics statistics) {
        this.frameResults = frameResults;
        this.meanRadialProfile = meanRadialProfile;
        this.meanHighFrequencyScore = meanHighFrequencyScore;
        this.statistics = statistics;
    }

    /**
     * Compute the element-wise mean profile and the score statistics.
     *
     * @param frameResults per-frame results in frame order, all with equal profile length
     */
    public static SequenceResult of(List<FrameResult> frameResults) {
        if (frameResults.isEmpty()) {
            throw new IllegalArgumentException("A sequence result needs at least one frame");
        }
        int length = frameResults.get(0).getRadialProfile().length();
        double[] sums = new double[length];
        double[] scores = new double[frameResults.size()];
        double scoreTotal = 0;

        for (int i = 0; i < frameResults.size(); i++) {
            FrameResult fr = frameResults.get(i);
            RadialProfile profile = fr.getRadialProfile();
            if (profile.length() != length) {
                throw new IllegalArgumentException("Frame " + fr.getFrameIndex() + " has profile length "
                    + profile.length() + ", expected " + length);
            }
            for (int r = 0; r < length; r++) {
                sums[r] += profile.get(r);
            }
            scores[i] = fr.getHighFrequencyScore();
            scoreTotal += scores[i];
        }

        int n = frameResults.size();
        for (int r = 0; r < length; r++) {
            sums[r] /= n;
        }

        return new SequenceResult(
            Collections.unmodifiableList(new ArrayList<>(frameResults)),
            new RadialProfile(sums),
            scoreTotal / n,
            ScoreStatistics.of(scores));
    }

    public List<FrameResult> getFrameResults() { return frameResults; }
    public RadialProfile getMeanRadialProfile() { return meanRadialProfile; }
    public double getMeanHighFrequencyScore() { return meanHighFrequencyScore; }
    public ScoreStatistics getStatistics() { return statistics; }

    public int getFrameCount() {
        return frameResults.size();
    }
}
