package org.abmkit.runtime.space;

import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.spi.IRandomProvider;

/**
 * Spatial structure constraining agent positions. A space keeps its own occupancy
 * bookkeeping in sync with agent positions; models call into it whenever agents are added,
 * removed or moved.
 *
 * @param <P> the position type
 */
public interface ISpace<P> {

    /**
     * Checks whether a declared {@code pos} field type fits this space's coordinate domain.
     *
     * @param fieldType the declared type of an agent's {@code pos} field
     * @return true if agents with such a field can live in this space
     */
    boolean acceptsPositionField(Class<?> fieldType);

    /**
     * @return a human-readable name of the coordinate type, used in validation messages
     */
    String describePositionType();

    /**
     * Checks that a new agent can be placed at the given position: the position has the right
     * dimensionality, lies inside the space and, for single-occupancy spaces, is free.
     *
     * @param pos the position
     * @throws IllegalArgumentException if the position is malformed or outside the space
     * @throws IllegalStateException if the position is occupied in a single-occupancy space
     */
    void validatePlacement(P pos);

    /**
     * Registers an agent at its current position. Callers validate with
     * {@link #validatePlacement(Object)} first.
     */
    void addAgent(PositionedAgent<P> agent);

    void removeAgent(PositionedAgent<P> agent);

    /**
     * Moves an agent to a new position and updates its {@code pos}.
     *
     * @param agent the agent
     * @param pos the target position, already normalized
     */
    void moveAgent(PositionedAgent<P> agent, P pos);

    /**
     * @param random the model's random source
     * @return a uniformly random valid position
     */
    P randomPosition(IRandomProvider random);
}
