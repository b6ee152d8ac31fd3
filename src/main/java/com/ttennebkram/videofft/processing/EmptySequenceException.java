package com.ttennebkram.videofft.processing;

/**
 * No frame was available to analyze.
 */
public class EmptySequenceException extends SpectralAnalysisException {

    public EmptySequenceException(String message) {
        super(message, NO_FRAME, null);
    }

    @Override
    public EmptySequenceException atFrame(int frameIndex) {
        return this;
    }
}
