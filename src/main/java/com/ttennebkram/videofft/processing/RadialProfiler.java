package com.ttennebkram.videofft.processing;

import com.ttennebkram.videofft.model.MagnitudeSpectrum;
import com.ttennebkram.videofft.model.RadialProfile;

/**
 * Collapses a centered spectrum into rings around (height / 2, width / 2) and scores
 * the energy left in the upper half of the radius range.
 */
public class RadialProfiler {

    private final RadiusBounds radiusBounds;

    public RadialProfiler() {
        this(RadiusBounds.INSCRIBED);
    }

    public RadialProfiler(RadiusBounds radiusBounds) {
        this.radiusBounds = radiusBounds;
    }

    /**
     * Profile plus high-frequency score of one spectrum.
     */
    public static class Result {
        public final RadialProfile profile;
        public final double highFrequencyScore;

        public Result(RadialProfile profile, double highFrequencyScore) {
            this.profile = profile;
            this.highFrequencyScore = highFrequencyScore;
        }
    }

    public Result profile(MagnitudeSpectrum spectrum) {
        RadialProfile profile = radialProfile(spectrum);
        return new Result(profile, highFrequencyScore(profile));
    }

    /**
     * Mean spectrum value per integer radius bin, bins 0 .. maxRadius.
     */
    public RadialProfile radialProfile(MagnitudeSpectrum spectrum) {
        int height = spectrum.getHeight();
        int width = spectrum.getWidth();
        int maxRadius = radiusBounds.maxRadius(height, width);
        if (maxRadius < 1) {
            throw new DegenerateSpectrumException("Spectrum " + height + "x" + width
                + " is too small for a radial profile (max radius " + maxRadius + ")");
        }

        int cy = spectrum.getCenterRow();
        int cx = spectrum.getCenterCol();
        double[] sums = new double[maxRadius + 1];
        long[] counts = new long[maxRadius + 1];
        double[] values = spectrum.getValues();

        for (int y = 0; y < height; y++) {
            int dy = y - cy;
            int dy2 = dy * dy;
            for (int x = 0; x < width; x++) {
                int dx = x - cx;
                int r = (int) Math.sqrt((double) dx * dx + dy2);
                if (r <= maxRadius) {
                    sums[r] += values[y * width + x];
                    counts[r]++;
                }
            }
        }

        for (int r = 0; r <= maxRadius; r++) {
            if (counts[r] == 0) {
                throw new DegenerateSpectrumException("Radius bin " + r + " has no samples");
            }
            sums[r] /= counts[r];
        }
        return new RadialProfile(sums);
    }

    /**
     * Sum (not mean) of the bins from maxRadius / 2 up to maxRadius.
     */
    public double highFrequencyScore(RadialProfile profile) {
        return profile.sumFrom(highFrequencyStart(profile.getMaxRadius()));
    }

    /**
     * First bin of the high-frequency band: the smallest integer r with r >= maxRadius / 2.
     */
    public static int highFrequencyStart(int maxRadius) {
        return (maxRadius + 1) / 2;
    }
}
