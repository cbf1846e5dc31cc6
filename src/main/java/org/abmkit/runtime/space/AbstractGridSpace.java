package org.abmkit.runtime.space;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.api.UnsupportedMetricException;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base class of discrete grid spaces.
 * <p>
 * Positions are 1-based {@code int[]} coordinates: along dimension {@code i} the valid values
 * are {@code 1..extent[i]}. Cells are addressed internally by a row-major flat index.
 */
public abstract class AbstractGridSpace implements ISpace<int[]> {

    protected final int[] extent;
    protected final boolean periodic;
    protected final Metric metric;
    protected final int cellCount;
    private final int[] strides;

    // Offsets are cached per integer radius; lists and arrays are never handed out for mutation.
    private final Int2ObjectOpenHashMap<List<int[]>> offsetCache = new Int2ObjectOpenHashMap<>();

    /**
     * Creates a grid.
     *
     * @param extent number of cells along each dimension
     * @param periodic whether the grid wraps around at its edges
     * @param metric the distance metric
     * @throws IllegalArgumentException if an extent is not positive or the cell count overflows an {@code int}
     */
    protected AbstractGridSpace(int[] extent, boolean periodic, Metric metric) {
        if (extent == null || extent.length == 0) {
            throw new IllegalArgumentException("Grid extent must have at least one dimension.");
        }
        for (int e : extent) {
            if (e <= 0) {
                throw new IllegalArgumentException("Grid extent must be positive in every dimension: " + Arrays.toString(extent));
            }
        }
        this.extent = extent.clone();
        this.periodic = periodic;
        this.metric = metric == null ? Metric.CHEBYSHEV : metric;
        this.strides = new int[extent.length];
        int stride = 1;
        for (int i = extent.length - 1; i >= 0; i--) {
            this.strides[i] = stride;
            try {
                stride = Math.multiplyExact(stride, extent[i]);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Grid extent " + Arrays.toString(extent)
                        + " has more than " + Integer.MAX_VALUE + " cells.", e);
            }
        }
        this.cellCount = stride;
    }

    public int[] getExtent() {
        return extent.clone();
    }

    public boolean isPeriodic() {
        return periodic;
    }

    public Metric getMetric() {
        return metric;
    }

    public int getDimensions() {
        return extent.length;
    }

    /**
     * Normalizes a position for the extent of this grid: periodic grids wrap into
     * {@code 1..extent}, bounded grids clamp to it.
     *
     * @param pos any position of matching dimensionality
     * @return a new, valid position
     */
    public int[] normalizePosition(int[] pos) {
        checkDimensions(pos);
        int[] normalized = new int[pos.length];
        for (int i = 0; i < pos.length; i++) {
            if (periodic) {
                normalized[i] = Math.floorMod(pos[i] - 1, extent[i]) + 1;
            } else {
                normalized[i] = Math.max(1, Math.min(extent[i], pos[i]));
            }
        }
        return normalized;
    }

    /**
     * @param pos a valid position
     * @return ids of all agents in that cell
     */
    public abstract IntList idsInPosition(int[] pos);

    /**
     * @param pos a valid position
     * @return true if no agent occupies the cell
     */
    public abstract boolean isEmpty(int[] pos);

    /**
     * Returns every integer offset whose distance from the origin equals {@code floor(r)}
     * under this grid's metric.
     *
     * @param r the radius, must be non-negative
     * @return an unmodifiable list of offsets; callers must not modify the arrays
     * @throws UnsupportedMetricException if the metric has no fixed-radius offset set
     */
    public List<int[]> offsetsAtRadius(double r) {
        if (!metric.hasFixedRadiusOffsets()) {
            throw new UnsupportedMetricException(metric,
                    "Offsets at a fixed radius are not defined for the " + metric + " metric on a grid.");
        }
        if (!(r >= 0)) {
            throw new IllegalArgumentException("Radius must be non-negative, got " + r);
        }
        int radius = (int) Math.floor(r);
        List<int[]> cached = offsetCache.get(radius);
        if (cached == null) {
            cached = computeOffsets(radius);
            offsetCache.put(radius, cached);
        }
        return cached;
    }

    private List<int[]> computeOffsets(int radius) {
        int dims = extent.length;
        List<int[]> offsets = new ArrayList<>();
        int[] current = new int[dims];
        Arrays.fill(current, -radius);
        while (true) {
            if (metric.length(current) == radius) {
                offsets.add(current.clone());
            }
            int d = dims - 1;
            while (d >= 0 && current[d] == radius) {
                current[d] = -radius;
                d--;
            }
            if (d < 0) {
                break;
            }
            current[d]++;
        }
        return Collections.unmodifiableList(offsets);
    }

    /**
     * Picks the offset a random walk should take from {@code pos}.
     *
     * @param pos the walker's current position
     * @param offsets candidate offsets at the walk radius
     * @param random the model's random source
     * @return the chosen offset, or {@code null} if the agent should stay in place
     */
    public abstract int[] chooseRandomWalkOffset(int[] pos, List<int[]> offsets, IRandomProvider random);

    @Override
    public boolean acceptsPositionField(Class<?> fieldType) {
        return fieldType == int[].class;
    }

    @Override
    public String describePositionType() {
        return "int[" + extent.length + "]";
    }

    @Override
    public void validatePlacement(int[] pos) {
        checkInside(pos);
    }

    @Override
    public int[] randomPosition(IRandomProvider random) {
        int[] pos = new int[extent.length];
        for (int i = 0; i < extent.length; i++) {
            pos[i] = 1 + random.nextInt(extent[i]);
        }
        return pos;
    }

    @Override
    public void moveAgent(PositionedAgent<int[]> agent, int[] pos) {
        checkInside(pos);
        removeAgent(agent);
        agent.setPos(pos.clone());
        addAgent(agent);
    }

    protected void checkDimensions(int[] pos) {
        if (pos == null) {
            throw new IllegalArgumentException("Position must not be null.");
        }
        if (pos.length != extent.length) {
            throw new IllegalArgumentException("Coordinate dimensions do not match grid dimensions: "
                    + Arrays.toString(pos) + " vs extent " + Arrays.toString(extent));
        }
    }

    protected void checkInside(int[] pos) {
        checkDimensions(pos);
        for (int i = 0; i < pos.length; i++) {
            if (pos[i] < 1 || pos[i] > extent[i]) {
                throw new IllegalArgumentException("Position " + Arrays.toString(pos)
                        + " is outside the grid of extent " + Arrays.toString(extent));
            }
        }
    }

    /**
     * Converts a valid 1-based position to its row-major flat index.
     */
    protected int flatIndex(int[] pos) {
        int index = 0;
        for (int i = 0; i < pos.length; i++) {
            index += (pos[i] - 1) * strides[i];
        }
        return index;
    }

    @Override
    public String toString() {
        return String.format("%s with size %s, metric=%s, periodic=%s",
                getClass().getSimpleName(), Arrays.toString(extent), metric.name().toLowerCase(), periodic);
    }
}
