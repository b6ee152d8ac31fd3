package com.ttennebkram.videofft.processing;

/**
 * Base class for failures that abort a spectral analysis run.
 * Carries the index of the offending frame, or {@link #NO_FRAME} when the failure
 * is not tied to a particular frame.
 */
public abstract class SpectralAnalysisException extends RuntimeException {

    public static final int NO_FRAME = -1;

    private final int frameIndex;

    protected SpectralAnalysisException(String message, int frameIndex, Throwable cause) {
        super(message, cause);
        this.frameIndex = frameIndex;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public boolean hasFrameIndex() {
        return frameIndex != NO_FRAME;
    }

    /**
     * Copy of this exception tagged with the given frame index.
     */
    public abstract SpectralAnalysisException atFrame(int frameIndex);

    /**
     * Message without the frame tag.
     */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (!hasFrameIndex()) {
            return super.getMessage();
        }
        return "frame " + frameIndex + ": " + super.getMessage();
    }
}
