package com.holdemengine.rng;

/**
 * Deterministic random source (Mulberry32). The same seed always yields the same sequence.
 * Not suitable for real games.
 */
public class SeededRandomSource implements RandomSource {

    private static final double TWO_POW_32 = 4294967296.0;

    private int state;

    public SeededRandomSource(long seed) {
        this.state = (int) seed;
    }

    @Override
    public int nextInt(int maxExclusive) {
        if (maxExclusive <= 0) {
            throw new IllegalArgumentException("maxExclusive must be greater than 0: " + maxExclusive);
        }
        return (int) Math.floor(nextUnit() * maxExclusive);
    }

    /**
     * Next value in {@code [0, 1)}.
     */
    private double nextUnit() {
        state += 0x6D2B79F5;
        int t = state;
        t = (t ^ (t >>> 15)) * (t | 1);
        t ^= t + (t ^ (t >>> 7)) * (t | 61);
        long unsigned = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return unsigned / TWO_POW_32;
    }
}
