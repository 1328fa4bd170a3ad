package com.warden.util;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Random;

/**
 * Random draws used by recovery actions: escape coordinates and jittered waits.
 * Seedable so tests can reproduce a sequence.
 */
@Singleton
public class Randomization {

    private final Random random;

    @Inject
    public Randomization() {
        this.random = new Random();
    }

    /**
     * Constructor with seeded random for deterministic testing.
     *
     * @param seed the random seed
     */
    public Randomization(long seed) {
        this.random = new Random(seed);
    }

    // ========================================================================
    // Gaussian (Normal) Distribution
    // ========================================================================

    /**
     * Generate a random value from a Gaussian (normal) distribution.
     *
     * @param mean   the mean of the distribution
     * @param stdDev the standard deviation of the distribution
     * @return a random value from N(mean, stdDev^2)
     */
    public synchronized double gaussianRandom(double mean, double stdDev) {
        return mean + random.nextGaussian() * stdDev;
    }

    /**
     * Generate a bounded long from a Gaussian distribution.
     * Used for jittered waits.
     *
     * @param mean   the mean in milliseconds
     * @param stdDev the standard deviation in milliseconds
     * @param min    the minimum allowed value in milliseconds
     * @param max    the maximum allowed value in milliseconds
     * @return a random long from N(mean, stdDev^2) clamped to [min, max]
     */
    public long gaussianRandomLong(double mean, double stdDev, long min, long max) {
        return Math.round(clamp(gaussianRandom(mean, stdDev), min, max));
    }

    // ========================================================================
    // Uniform Distribution
    // ========================================================================

    /**
     * Generate a uniformly distributed integer in [min, max] inclusive.
     *
     * @param min the minimum value
     * @param max the maximum value
     * @return a random integer
     */
    public synchronized int uniformRandomInt(int min, int max) {
        if (min >= max) {
            return min;
        }
        return min + random.nextInt(max - min + 1);
    }

    /**
     * Generate a uniformly distributed long in [min, max] inclusive.
     *
     * @param min the minimum value
     * @param max the maximum value
     * @return a random long
     */
    public synchronized long uniformRandomLong(long min, long max) {
        if (min >= max) {
            return min;
        }
        return min + (long) (random.nextDouble() * (max - min + 1));
    }

    /**
     * Return true with the given probability.
     *
     * @param probability value in [0, 1]
     * @return true with that probability
     */
    public synchronized boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
