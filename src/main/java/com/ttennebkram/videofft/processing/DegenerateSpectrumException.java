package com.ttennebkram.videofft.processing;

/**
 * Spectrum too small to hold a radial profile with at least two bins.
 */
public class DegenerateSpectrumException extends SpectralAnalysisException {

    public DegenerateSpectrumException(String message) {
        super(message, NO_FRAME, null);
    }

    public DegenerateSpectrumException(String message, int frameIndex, Throwable cause) {
        super(message, frameIndex, cause);
    }

    @Override
    public DegenerateSpectrumException atFrame(int frameIndex) {
        return new DegenerateSpectrumException(getDetail(), frameIndex, this);
    }
}
