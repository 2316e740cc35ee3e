package com.holdemengine.rng;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the random source contract shared by the seeded and secure implementations.
 */
class RandomSourceTest {

    @Test
    void testSeededSourceIsDeterministic() {
        SeededRandomSource first = new SeededRandomSource(12345);
        SeededRandomSource second = new SeededRandomSource(12345);

        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextInt(52), second.nextInt(52));
        }
    }

    @Test
    void testDifferentSeedsDiverge() {
        SeededRandomSource first = new SeededRandomSource(1);
        SeededRandomSource second = new SeededRandomSource(2);

        boolean differs = false;
        for (int i = 0; i < 20 && !differs; i++) {
            differs = first.nextInt(1_000_000) != second.nextInt(1_000_000);
        }
        assertTrue(differs);
    }

    @Test
    void testValuesStayInRange() {
        RandomSource seeded = new SeededRandomSource(99);
        RandomSource secure = new SecureRandomSource();

        for (int i = 0; i < 1000; i++) {
            int a = seeded.nextInt(7);
            int b = secure.nextInt(7);
            assertTrue(a >= 0 && a < 7);
            assertTrue(b >= 0 && b < 7);
        }
        assertEquals(0, seeded.nextInt(1));
    }

    @Test
    void testNonPositiveBoundRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SeededRandomSource(1).nextInt(0));
        assertThrows(IllegalArgumentException.class, () -> new SecureRandomSource().nextInt(-3));
    }
}
