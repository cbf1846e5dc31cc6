package org.abmkit.runtime.spi;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a single model.
 * Implementations should be pure with respect to the provided seed. A provider is
 * owned by exactly one model and is not safe for concurrent use.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Provides the underlying commons-math generator, e.g. to back a
     * {@code RealDistribution} with the model's random stream.
     *
     * @return the generator
     */
    RandomGenerator asRandomGenerator();

    /**
     * Returns the seed this provider was created with.
     *
     * @return the seed
     */
    long getSeed();
}
