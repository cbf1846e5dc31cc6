package org.abmkit.runtime.model;

/**
 * An agent in continuous space that carries a velocity vector of the space's dimensionality.
 * Random walks reorient and rescale this vector.
 */
public interface MovingAgent extends PositionedAgent<double[]> {

    double[] getVel();

    void setVel(double[] vel);
}
