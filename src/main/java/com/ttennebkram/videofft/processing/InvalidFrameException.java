package com.ttennebkram.videofft.processing;

/**
 * Frame data is empty, contains non-finite samples, or does not match the
 * dimensions of the rest of the sequence.
 */
public class InvalidFrameException extends SpectralAnalysisException {

    public InvalidFrameException(String message) {
        super(message, NO_FRAME, null);
    }

    public InvalidFrameException(String message, int frameIndex, Throwable cause) {
        super(message, frameIndex, cause);
    }

    @Override
    public InvalidFrameException atFrame(int frameIndex) {
        return new InvalidFrameException(getDetail(), frameIndex, this);
    }
}
