package org.abmkit.runtime.movement;

import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.api.UnsupportedMetricException;
import org.abmkit.runtime.model.MovingAgent;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.space.AbstractGridSpace;
import org.abmkit.runtime.space.ContinuousSpace;
import org.abmkit.runtime.spi.IRandomProvider;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Walks and random walks on grid and continuous spaces.
 * <p>
 * All moves go through {@link AgentBasedModel#moveAgent(PositionedAgent, Object)}, so the
 * space's occupancy index stays consistent. Targets are normalized first: periodic spaces
 * wrap, bounded spaces clamp to their edge.
 */
public final class Movement {

    private Movement() {}

    /**
     * Normalizes a grid position for the model's space.
     */
    public static int[] normalizePosition(int[] pos, AgentBasedModel<?, ? extends AbstractGridSpace> model) {
        return gridSpace(model).normalizePosition(pos);
    }

    /**
     * Normalizes a continuous position for the model's space.
     */
    public static double[] normalizePosition(double[] pos, AgentBasedModel<?, ? extends ContinuousSpace> model) {
        return continuousSpace(model).normalizePosition(pos);
    }

    /**
     * Moves the agent by {@code direction}, but only if the target cell is empty.
     *
     * @return true if the agent moved
     */
    public static boolean walk(PositionedAgent<int[]> agent, int[] direction,
                               AgentBasedModel<?, ? extends AbstractGridSpace> model) {
        return walk(agent, direction, model, true);
    }

    /**
     * Moves the agent by {@code direction}.
     *
     * @param ifEmpty if true, an occupied target cell leaves the agent where it is
     * @return true if the agent moved
     * @throws IllegalStateException if {@code ifEmpty} is false and a single-occupancy target is taken
     */
    public static boolean walk(PositionedAgent<int[]> agent, int[] direction,
                               AgentBasedModel<?, ? extends AbstractGridSpace> model, boolean ifEmpty) {
        AbstractGridSpace space = gridSpace(model);
        int[] pos = agent.getPos();
        if (direction.length != pos.length) {
            throw new IllegalArgumentException("Direction " + Arrays.toString(direction)
                    + " does not match position " + Arrays.toString(pos));
        }
        int[] target = new int[pos.length];
        for (int i = 0; i < pos.length; i++) {
            target[i] = pos[i] + direction[i];
        }
        target = space.normalizePosition(target);
        if (ifEmpty && !space.isEmpty(target)) {
            return false;
        }
        model.moveAgent(agent, target);
        return true;
    }

    /**
     * Moves the agent by {@code direction}. Velocity is neither used nor changed.
     */
    public static void walk(PositionedAgent<double[]> agent, double[] direction,
                            AgentBasedModel<?, ? extends ContinuousSpace> model) {
        ContinuousSpace space = continuousSpace(model);
        double[] pos = agent.getPos();
        if (direction.length != pos.length) {
            throw new IllegalArgumentException("Direction " + Arrays.toString(direction)
                    + " does not match position " + Arrays.toString(pos));
        }
        double[] target = new double[pos.length];
        for (int i = 0; i < pos.length; i++) {
            target[i] = pos[i] + direction[i];
        }
        model.moveAgent(agent, space.normalizePosition(target));
    }

    /**
     * Moves the agent to a uniformly chosen neighbor at distance 1.
     *
     * @return true if the agent moved
     */
    public static boolean randomWalk(PositionedAgent<int[]> agent,
                                     AgentBasedModel<?, ? extends AbstractGridSpace> model) {
        return randomWalk(agent, model, 1, true);
    }

    /**
     * Moves the agent to a uniformly chosen cell at distance {@code floor(r)}.
     *
     * @return true if the agent moved
     */
    public static boolean randomWalk(PositionedAgent<int[]> agent,
                                     AgentBasedModel<?, ? extends AbstractGridSpace> model, double r) {
        return randomWalk(agent, model, r, true);
    }

    /**
     * Moves the agent to a uniformly chosen cell at distance {@code floor(r)} under the grid's
     * metric. On a single-occupancy grid only empty cells are candidates and {@code ifEmpty}
     * has no effect; when none is free the agent stays.
     *
     * @param ifEmpty on a multi-occupancy grid, whether an occupied target cancels the move
     * @return true if the agent moved
     * @throws UnsupportedMetricException if the grid uses the Euclidean metric
     */
    public static boolean randomWalk(PositionedAgent<int[]> agent,
                                     AgentBasedModel<?, ? extends AbstractGridSpace> model,
                                     double r, boolean ifEmpty) {
        AbstractGridSpace space = gridSpace(model);
        List<int[]> offsets = space.offsetsAtRadius(r);
        int[] offset = space.chooseRandomWalkOffset(agent.getPos(), offsets, model.getRandomProvider());
        if (offset == null) {
            return false;
        }
        return walk(agent, offset, model, ifEmpty);
    }

    /**
     * Reorients the agent's velocity by a polar angle from {@link AngleDistributions#defaultPolar()}
     * (and, in 3D, an azimuthal angle from {@link AngleDistributions#defaultAzimuthal()}), then
     * moves by the new velocity. Speed is preserved.
     * <p>
     * A zero velocity has no direction to rotate and is rejected in 2D as well as 3D, even
     * though rotating a zero vector in the plane would simply leave the agent in place.
     *
     * @throws IllegalArgumentException if the velocity is zero or the space is not 2D or 3D
     */
    public static void randomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model) {
        continuousRandomWalk(agent, model, Double.NaN, null, null);
    }

    /**
     * As {@link #randomWalk(MovingAgent, AgentBasedModel)}, with a custom polar distribution.
     */
    public static void randomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model,
                                  IAngleDistribution polar) {
        continuousRandomWalk(agent, model, Double.NaN, Objects.requireNonNull(polar, "polar"), null);
    }

    /**
     * 3D variant with custom polar and azimuthal distributions.
     */
    public static void randomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model,
                                  IAngleDistribution polar, IAngleDistribution azimuthal) {
        continuousRandomWalk(agent, model, Double.NaN,
                Objects.requireNonNull(polar, "polar"), Objects.requireNonNull(azimuthal, "azimuthal"));
    }

    /**
     * Reorients the velocity with the default distributions, rescales it to length {@code r}
     * and moves the agent by it.
     *
     * @throws IllegalArgumentException if {@code r <= 0}
     */
    public static void randomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model,
                                  double r) {
        requirePositiveDisplacement(r);
        continuousRandomWalk(agent, model, r, null, null);
    }

    public static void randomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model,
                                  double r, IAngleDistribution polar) {
        requirePositiveDisplacement(r);
        continuousRandomWalk(agent, model, r, Objects.requireNonNull(polar, "polar"), null);
    }

    public static void randomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model,
                                  double r, IAngleDistribution polar, IAngleDistribution azimuthal) {
        requirePositiveDisplacement(r);
        continuousRandomWalk(agent, model, r,
                Objects.requireNonNull(polar, "polar"), Objects.requireNonNull(azimuthal, "azimuthal"));
    }

    /**
     * Advances the agent by {@code vel * dt}.
     */
    public static void moveByVelocity(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model, double dt) {
        double[] vel = agent.getVel();
        double[] direction = new double[vel.length];
        for (int i = 0; i < vel.length; i++) {
            direction[i] = vel[i] * dt;
        }
        walk(agent, direction, model);
    }

    private static void continuousRandomWalk(MovingAgent agent, AgentBasedModel<?, ? extends ContinuousSpace> model,
                                             double r, IAngleDistribution polar, IAngleDistribution azimuthal) {
        ContinuousSpace space = continuousSpace(model);
        int dims = space.getDimensions();
        if (dims != 2 && dims != 3) {
            throw new IllegalArgumentException("Continuous random walks are defined in 2 or 3 dimensions, space has " + dims);
        }
        if (dims == 2 && azimuthal != null) {
            throw new IllegalArgumentException("An azimuthal distribution only applies to 3D spaces.");
        }
        double[] vel = agent.getVel();
        if (vel == null || vel.length != dims) {
            throw new IllegalArgumentException("Velocity " + Arrays.toString(vel) + " does not match a " + dims + "D space");
        }
        double speed = norm(vel);
        if (speed == 0) {
            throw new IllegalArgumentException("Agent " + agent.getId() + " has zero velocity and no direction to rotate.");
        }

        IRandomProvider random = model.getRandomProvider();
        IAngleDistribution polarDist = polar != null ? polar : AngleDistributions.defaultPolar();
        double theta = polarDist.sample(random);
        double[] direction;
        if (dims == 2) {
            direction = VectorRotation.rotate(vel, theta);
        } else {
            IAngleDistribution azimuthalDist = azimuthal != null ? azimuthal : AngleDistributions.defaultAzimuthal();
            double phi = azimuthalDist.sample(random);
            direction = VectorRotation.rotate(vel, theta, phi);
        }
        if (!Double.isNaN(r)) {
            double scale = r / speed;
            for (int i = 0; i < dims; i++) {
                direction[i] *= scale;
            }
        }
        agent.setVel(direction.clone());
        walk(agent, direction, model);
    }

    private static void requirePositiveDisplacement(double r) {
        if (!(r > 0)) {
            throw new IllegalArgumentException("The displacement must be larger than 0, got " + r);
        }
    }

    private static double norm(double[] v) {
        double sum = 0;
        for (double x : v) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    private static AbstractGridSpace gridSpace(AgentBasedModel<?, ? extends AbstractGridSpace> model) {
        AbstractGridSpace space = model.getSpace();
        if (space == null) {
            throw new IllegalStateException("Model has no space.");
        }
        return space;
    }

    private static ContinuousSpace continuousSpace(AgentBasedModel<?, ? extends ContinuousSpace> model) {
        ContinuousSpace space = model.getSpace();
        if (space == null) {
            throw new IllegalStateException("Model has no space.");
        }
        return space;
    }
}
