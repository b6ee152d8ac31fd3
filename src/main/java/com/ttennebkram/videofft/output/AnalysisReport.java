package com.ttennebkram.videofft.output;

import java.util.Collections;
import java.util.List;

/**
 * Flat, serializable summary of a run. Radial profiles are carried as a separate
 * numeric array rather than inside the per-frame entries.
 */
public class AnalysisReport {

    /**
     * One per-frame entry of the report.
     */
    public static class FrameScore {
        public final int frameIndex;
        public final double highFrequencyScore;

        public FrameScore(int frameIndex, double highFrequencyScore) {
            this.frameIndex = frameIndex;
            this.highFrequencyScore = highFrequencyScore;
        }
    }

    private final String inputFile;
    private final int frameCount;
    private final double meanHighFrequencyScore;
    private final double maxHighFrequencyScore;
    private final double minHighFrequencyScore;
    private final double medianHighFrequencyScore;
    private final double pct05;
    private final double pct95;
    private final List<FrameScore> perFrame;
    private final double[] meanRadialProfile;

    AnalysisReport(String inputFile, int frameCount, double meanHighFrequencyScore,
                   double maxHighFrequencyScore, double minHighFrequencyScore,
                   double medianHighFrequencyScore, double pct05, double pct95,
                   List<FrameScore> perFrame, double[] meanRadialProfile) {
        this.inputFile = inputFile;
        this.frameCount = frameCount;
        this.meanHighFrequencyScore = meanHighFrequencyScore;
        this.maxHighFrequencyScore = maxHighFrequencyScore;
        this.minHighFrequencyScore = minHighFrequencyScore;
        this.medianHighFrequencyScore = medianHighFrequencyScore;
        this.pct05 = pct05;
        this.pct95 = pct95;
        this.perFrame = Collections.unmodifiableList(perFrame);
        this.meanRadialProfile = meanRadialProfile;
    }

    /** Absolute path of the analyzed input, or null when frames did not come from a file. */
    public String getInputFile() { return inputFile; }
    public int getFrameCount() { return frameCount; }
    public double getMeanHighFrequencyScore() { return meanHighFrequencyScore; }
    public double getMaxHighFrequencyScore() { return maxHighFrequencyScore; }
    public double getMinHighFrequencyScore() { return minHighFrequencyScore; }
    public double getMedianHighFrequencyScore() { return medianHighFrequencyScore; }
    public double getPct05() { return pct05; }
    public double getPct95() { return pct95; }
    public List<FrameScore> getPerFrame() { return perFrame; }

    public double[] getMeanRadialProfile() {
        return meanRadialProfile.clone();
    }
}
