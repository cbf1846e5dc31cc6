package org.abmkit.runtime.movement;

import org.abmkit.runtime.spi.IRandomProvider;

/**
 * A source of angles (in radians) for random-walk reorientation.
 */
@FunctionalInterface
public interface IAngleDistribution {

    /**
     * @param random the model's random source
     * @return an angle in radians
     */
    double sample(IRandomProvider random);
}
