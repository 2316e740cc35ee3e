package com.holdemengine.rng;

import java.security.SecureRandom;

/**
 * Cryptographically strong random source for production tables.
 */
public class SecureRandomSource implements RandomSource {

    private final SecureRandom random;

    public SecureRandomSource() {
        this(new SecureRandom());
    }

    public SecureRandomSource(SecureRandom random) {
        this.random = random;
    }

    @Override
    public int nextInt(int maxExclusive) {
        if (maxExclusive <= 0) {
            throw new IllegalArgumentException("maxExclusive must be greater than 0: " + maxExclusive);
        }
        return random.nextInt(maxExclusive);
    }
}
