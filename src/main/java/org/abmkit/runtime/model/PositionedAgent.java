package org.abmkit.runtime.model;

/**
 * An agent that lives in a space. The second declared instance field must be {@code pos}
 * and its type must match the space's coordinate domain: {@code int[]} for grid spaces,
 * {@code double[]} for continuous space and {@code int} for graph space.
 *
 * @param <P> the position type
 */
public interface PositionedAgent<P> extends Agent {

    P getPos();

    /**
     * Sets the position. Only spaces call this; user code moves agents through the model
     * so the space's occupancy bookkeeping stays consistent.
     *
     * @param pos the new position
     */
    void setPos(P pos);
}
