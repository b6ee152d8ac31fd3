package com.ttennebkram.videofft.model;

/**
 * Per-frame outcome of the spectral pipeline.
 */
public class FrameResult {

    private final int frameIndex;
    private final RadialProfile radialProfile;
    private final double highFrequencyScore;

    public FrameResult(int frameIndex, RadialProfile radialProfile, double highFrequencyScore) {
        this.frameIndex = frameIndex;
        this.radialProfile = radialProfile;
        this.highFrequencyScore = highFrequencyScore;
    }

    public int getFrameIndex() { return frameIndex; }
    public RadialProfile getRadialProfile() { return radialProfile; }
    public double getHighFrequencyScore() { return highFrequencyScore; }

    @Override
    public String toString() {
        return String.format("FrameResult[%d, score=%.3f]", frameIndex, highFrequencyScore);
    }
}
