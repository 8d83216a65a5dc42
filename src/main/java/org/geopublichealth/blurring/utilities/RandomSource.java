package org.geopublichealth.blurring.utilities;

import java.util.Objects;
import java.util.Random;
import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform random numbers in [0, 1) used for point displacement.
 * <p>
 * Instances are not expected to be thread-safe. Callers blurring points on
 * several threads should give each worker its own source so that the
 * sequences are not correlated.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns the next uniformly distributed value in [0, 1).
     */
    double nextDouble();

    /**
     * Creates a reproducible source from a seed.
     *
     * @param seed the seed
     * @return a deterministic random source
     */
    static RandomSource seeded(long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        return random::nextDouble;
    }

    /**
     * Wraps an existing {@link Random}.
     *
     * @param random the generator to draw from
     * @return a random source backed by the generator
     */
    static RandomSource of(Random random) {
        Objects.requireNonNull(random, "Random generator is required");
        return random::nextDouble;
    }

    /**
     * Returns a non-reproducible source drawing from the calling thread's
     * {@link ThreadLocalRandom}.
     */
    static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }
}
