package com.holdemengine.rng;

/**
 * Source of uniform random integers for dealing and shuffling.
 *
 * The betting engine never draws from it; it is exposed so a seeded source can stand in
 * for a secure one in tests through the same contract.
 */
public interface RandomSource {

    /**
     * @param maxExclusive exclusive upper bound, must be positive
     * @return an integer in {@code [0, maxExclusive)}
     * @throws IllegalArgumentException if {@code maxExclusive <= 0}
     */
    int nextInt(int maxExclusive);
}
