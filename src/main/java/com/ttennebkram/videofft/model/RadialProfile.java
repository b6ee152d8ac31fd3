package com.ttennebkram.videofft.model;

import java.util.Arrays;

/**
 * Azimuthally averaged spectrum: bin r holds the mean of all samples whose distance
 * from the spectrum center lies in [r, r + 1).
 */
public class RadialProfile {

    private final double[] bins;

    public RadialProfile(double[] bins) {
        if (bins == null || bins.length == 0) {
            throw new IllegalArgumentException("Radial profile needs at least one bin");
        }
        this.bins = bins.clone();
    }

    public int length() {
        return bins.length;
    }

    /**
     * Largest radius bin index.
     */
    public int getMaxRadius() {
        return bins.length - 1;
    }

    public double get(int radius) {
        return bins[radius];
    }

    public double[] toArray() {
        return bins.clone();
    }

    /**
     * Sum of bins from {@code fromRadius} to the last one, inclusive.
     */
    public double sumFrom(int fromRadius) {
        double total = 0;
        for (int r = Math.max(0, fromRadius); r < bins.length; r++) {
            total += bins[r];
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RadialProfile)) return false;
        return Arrays.equals(bins, ((RadialProfile) o).bins);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bins);
    }

    @Override
    public String toString() {
        return "RadialProfile" + Arrays.toString(bins);
    }
}
