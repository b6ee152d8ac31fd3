package com.ttennebkram.videofft.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RadialProfileTest {

    @Test
    void testSumFrom() {
        RadialProfile p = new RadialProfile(new double[]{5.0, 4.0, 3.0, 2.0, 1.0});
        assertEquals(4, p.getMaxRadius());
        assertEquals(6.0, p.sumFrom(2));
        assertEquals(15.0, p.sumFrom(0));
        assertEquals(0.0, p.sumFrom(5));
    }

    @Test
    void testBinsAreCopied() {
        double[] bins = {1.0, 2.0};
        RadialProfile p = new RadialProfile(bins);
        bins[0] = 99.0;
        p.toArray()[1] = 99.0;
        assertEquals(1.0, p.get(0));
        assertEquals(2.0, p.get(1));
    }

    @Test
    void testEmptyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RadialProfile(new double[0]));
    }
}
