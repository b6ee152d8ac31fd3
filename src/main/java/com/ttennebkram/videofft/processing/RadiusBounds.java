package com.ttennebkram.videofft.processing;

/**
 * Which rings of the spectrum make it into the radial profile.
 */
public enum RadiusBounds {

    /** Rings 0 .. min(h, w) / 2 - 1: only full rings inside the inscribed circle. */
    INSCRIBED,

    /** Every ring up to the farthest corner, including partial rings. */
    FULL;

    /**
     * Largest radius bin for a spectrum of the given size.
     */
    public int maxRadius(int height, int width) {
        if (this == INSCRIBED) {
            return Math.min(height, width) / 2 - 1;
        }
        int cy = height / 2;
        int cx = width / 2;
        int dy = Math.max(cy, height - 1 - cy);
        int dx = Math.max(cx, width - 1 - cx);
        return (int) Math.sqrt((double) dy * dy + (double) dx * dx);
    }

    public static RadiusBounds fromName(String name) {
        for (RadiusBounds b : values()) {
            if (b.name().equalsIgnoreCase(name)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown radius bounds '" + name + "', expected inscribed or full");
    }
}
