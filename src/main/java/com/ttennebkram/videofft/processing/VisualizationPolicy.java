package com.ttennebkram.videofft.processing;

/**
 * Which spectra are handed to the renderer.
 */
public enum VisualizationPolicy {
    NONE,
    /** The first frame only. */
    FIRST,
    /** Every frame. */
    ALL,
    /** The element-wise mean spectrum of the whole sequence, once at the end. */
    MEAN;

    public static VisualizationPolicy fromName(String name) {
        for (VisualizationPolicy p : values()) {
            if (p.name().equalsIgnoreCase(name)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown visualization policy '" + name + "'");
    }
}
