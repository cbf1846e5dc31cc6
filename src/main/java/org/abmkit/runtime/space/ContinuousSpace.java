package org.abmkit.runtime.space;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.spi.IRandomProvider;

import java.util.Arrays;

/**
 * Continuous space with {@code double[]} positions in {@code [0, extent)} along each dimension.
 * Agents may overlap freely, so the space keeps no occupancy index.
 */
public class ContinuousSpace implements ISpace<double[]> {

    private final double[] extent;
    private final boolean periodic;

    /**
     * @param extent the size along each dimension, all positive and finite
     * @param periodic whether positions wrap around at the edges
     */
    public ContinuousSpace(double[] extent, boolean periodic) {
        if (extent == null || extent.length == 0) {
            throw new IllegalArgumentException("Space extent must have at least one dimension.");
        }
        for (double e : extent) {
            if (!(e > 0) || Double.isInfinite(e)) {
                throw new IllegalArgumentException("Space extent must be positive and finite: " + Arrays.toString(extent));
            }
        }
        this.extent = extent.clone();
        this.periodic = periodic;
    }

    public double[] getExtent() {
        return extent.clone();
    }

    public boolean isPeriodic() {
        return periodic;
    }

    public int getDimensions() {
        return extent.length;
    }

    /**
     * Periodic spaces wrap each component modulo the extent; bounded spaces clamp it to
     * {@code [0, nextDown(extent)]} so positions never land on the upper boundary.
     *
     * @param pos any finite position of matching dimensionality
     * @return a new, valid position
     */
    public double[] normalizePosition(double[] pos) {
        checkDimensions(pos);
        double[] normalized = new double[pos.length];
        for (int i = 0; i < pos.length; i++) {
            if (periodic) {
                double wrapped = pos[i] - Math.floor(pos[i] / extent[i]) * extent[i];
                // Tiny negative inputs can round up to exactly the extent.
                normalized[i] = wrapped >= extent[i] ? 0.0 : wrapped;
            } else {
                normalized[i] = Math.max(0.0, Math.min(Math.nextDown(extent[i]), pos[i]));
            }
        }
        return normalized;
    }

    /**
     * Scans all agents of the model for those within distance {@code r} of {@code pos}. Periodic
     * spaces measure the shortest distance across the wrap.
     *
     * @param pos the query position
     * @param r the search radius
     * @param model the model whose agents live in this space
     * @return ids of all agents within the radius, in container order
     */
    public IntList nearbyIds(double[] pos, double r, AgentBasedModel<?, ? extends ContinuousSpace> model) {
        checkDimensions(pos);
        IntArrayList result = new IntArrayList();
        double r2 = r * r;
        for (Agent agent : model.agents()) {
            @SuppressWarnings("unchecked")
            double[] other = ((PositionedAgent<double[]>) agent).getPos();
            if (squaredDistance(pos, other) <= r2) {
                result.add(agent.getId());
            }
        }
        return result;
    }

    /**
     * @return the squared Euclidean distance, using the minimum image in periodic spaces
     */
    public double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = Math.abs(a[i] - b[i]);
            if (periodic) {
                d = Math.min(d, extent[i] - d);
            }
            sum += d * d;
        }
        return sum;
    }

    @Override
    public boolean acceptsPositionField(Class<?> fieldType) {
        return fieldType == double[].class;
    }

    @Override
    public String describePositionType() {
        return "double[" + extent.length + "]";
    }

    @Override
    public void validatePlacement(double[] pos) {
        checkInside(pos);
    }

    @Override
    public void addAgent(PositionedAgent<double[]> agent) {
        // no index to maintain
    }

    @Override
    public void removeAgent(PositionedAgent<double[]> agent) {
        // no index to maintain
    }

    @Override
    public void moveAgent(PositionedAgent<double[]> agent, double[] pos) {
        checkInside(pos);
        agent.setPos(pos.clone());
    }

    @Override
    public double[] randomPosition(IRandomProvider random) {
        double[] pos = new double[extent.length];
        for (int i = 0; i < extent.length; i++) {
            pos[i] = random.nextDouble() * extent[i];
        }
        return pos;
    }

    private void checkDimensions(double[] pos) {
        if (pos == null) {
            throw new IllegalArgumentException("Position must not be null.");
        }
        if (pos.length != extent.length) {
            throw new IllegalArgumentException("Coordinate dimensions do not match space dimensions: "
                    + Arrays.toString(pos) + " vs extent " + Arrays.toString(extent));
        }
    }

    private void checkInside(double[] pos) {
        checkDimensions(pos);
        for (int i = 0; i < pos.length; i++) {
            if (!(pos[i] >= 0 && pos[i] < extent[i])) {
                throw new IllegalArgumentException("Position " + Arrays.toString(pos)
                        + " is outside the space of extent " + Arrays.toString(extent));
            }
        }
    }

    @Override
    public String toString() {
        return String.format("ContinuousSpace with size %s, periodic=%s", Arrays.toString(extent), periodic);
    }
}
