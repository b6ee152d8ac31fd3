package com.ttennebkram.videofft.processing;

import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import com.ttennebkram.videofft.model.RadialProfile;

/**
 * Receives fully computed spectra selected by the visualization policy.
 */
public interface SpectrumRenderer {

    void renderFrame(int frameIndex, MagnitudeSpectrum spectrum, RadialProfile profile);

    void renderMean(MagnitudeSpectrum meanSpectrum, RadialProfile meanProfile);
}
