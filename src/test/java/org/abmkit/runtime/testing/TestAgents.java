package org.abmkit.runtime.testing;

import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.model.MovingAgent;
import org.abmkit.runtime.model.PositionedAgent;

/**
 * Agent types shared by the runtime tests.
 */
public final class TestAgents {

    private TestAgents() {}

    /** Non-spatial agent with a numeric property. */
    public static class Plain implements Agent {
        int id;
        double weight;

        public Plain(int id) {
            this(id, 0.0);
        }

        public Plain(int id, double weight) {
            this.id = id;
            this.weight = weight;
        }

        @Override
        public int getId() {
            return id;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }
    }

    public static class GridWalker implements PositionedAgent<int[]> {
        int id;
        int[] pos;

        public GridWalker(int id, int... pos) {
            this.id = id;
            this.pos = pos;
        }

        @Override
        public int getId() {
            return id;
        }

        @Override
        public int[] getPos() {
            return pos;
        }

        @Override
        public void setPos(int[] pos) {
            this.pos = pos;
        }
    }

    public static class Particle implements MovingAgent {
        int id;
        double[] pos;
        double[] vel;

        public Particle(int id, double[] pos, double[] vel) {
            this.id = id;
            this.pos = pos;
            this.vel = vel;
        }

        @Override
        public int getId() {
            return id;
        }

        @Override
        public double[] getPos() {
            return pos;
        }

        @Override
        public void setPos(double[] pos) {
            this.pos = pos;
        }

        @Override
        public double[] getVel() {
            return vel;
        }

        @Override
        public void setVel(double[] vel) {
            this.vel = vel;
        }
    }

    public static class NodeAgent implements PositionedAgent<Integer> {
        int id;
        int pos;

        public NodeAgent(int id, int pos) {
            this.id = id;
            this.pos = pos;
        }

        @Override
        public int getId() {
            return id;
        }

        @Override
        public Integer getPos() {
            return pos;
        }

        @Override
        public void setPos(Integer pos) {
            this.pos = pos;
        }
    }

    /** Closed union of three concrete kinds, declared out of canonical order. */
    public sealed interface Animal extends Agent permits Wolf, Sheep, Grass {
    }

    public static final class Wolf implements Animal {
        int id;
        double weight;

        public Wolf(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }
    }

    public static final class Sheep implements Animal {
        int id;
        double weight;

        public Sheep(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }
    }

    public static final class Grass implements Animal {
        int id;
        double weight;

        public Grass(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }
    }

    /** Abstract but not sealed, so its members must be listed explicitly. */
    public abstract static class OpenBase implements Agent {
        int id;

        protected OpenBase(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }
    }

    public static class OpenA extends OpenBase {
        public OpenA(int id) {
            super(id);
        }
    }

    public static class OpenB extends OpenBase {
        public OpenB(int id) {
            super(id);
        }
    }

    public static final class Frozen implements Agent {
        final int id;

        public Frozen(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }
    }

    public record RecordAgent(int id) implements Agent {
        @Override
        public int getId() {
            return id;
        }
    }

    public static class NameFirst implements Agent {
        String name;
        int id;

        @Override
        public int getId() {
            return id;
        }
    }

    public static class TextId implements Agent {
        String id;

        @Override
        public int getId() {
            return Integer.parseInt(id);
        }
    }

    public static class NoPos implements PositionedAgent<int[]> {
        int id;
        double weight;
        int[] pos;

        @Override
        public int getId() {
            return id;
        }

        @Override
        public int[] getPos() {
            return pos;
        }

        @Override
        public void setPos(int[] pos) {
            this.pos = pos;
        }
    }

    /** Has {@code id, pos} fields but does not implement {@link PositionedAgent}. */
    public static class Unplaced implements Agent {
        int id;
        int[] pos;

        @Override
        public int getId() {
            return id;
        }
    }

    public static class FloatVel implements PositionedAgent<double[]> {
        int id;
        double[] pos;
        float[] vel;

        public FloatVel(int id, double[] pos) {
            this.id = id;
            this.pos = pos;
        }

        @Override
        public int getId() {
            return id;
        }

        @Override
        public double[] getPos() {
            return pos;
        }

        @Override
        public void setPos(double[] pos) {
            this.pos = pos;
        }
    }
}
