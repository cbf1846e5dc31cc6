package org.abmkit.runtime.space;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Grid space in which every cell holds at most one agent. Occupancy is a flat owner grid
 * storing the occupant's id, 0 meaning empty.
 */
public class GridSpaceSingle extends AbstractGridSpace {

    private final int[] ownerGrid;

    public GridSpaceSingle(int[] extent, boolean periodic, Metric metric) {
        super(extent, periodic, metric);
        this.ownerGrid = new int[cellCount];
    }

    public GridSpaceSingle(int[] extent) {
        this(extent, true, Metric.CHEBYSHEV);
    }

    /**
     * @param pos a valid position
     * @return the id of the occupant, 0 if the cell is empty
     */
    public int idInPosition(int[] pos) {
        checkInside(pos);
        return ownerGrid[flatIndex(pos)];
    }

    @Override
    public IntList idsInPosition(int[] pos) {
        int id = idInPosition(pos);
        return id == 0 ? IntLists.EMPTY_LIST : IntLists.singleton(id);
    }

    @Override
    public boolean isEmpty(int[] pos) {
        return idInPosition(pos) == 0;
    }

    /**
     * Only offsets leading to an empty cell are candidates. When every neighbor at the radius
     * is taken the walker stays put.
     */
    @Override
    public int[] chooseRandomWalkOffset(int[] pos, List<int[]> offsets, IRandomProvider random) {
        List<int[]> available = new ArrayList<>(offsets.size());
        int[] target = new int[pos.length];
        for (int[] offset : offsets) {
            for (int i = 0; i < pos.length; i++) {
                target[i] = pos[i] + offset[i];
            }
            if (ownerGrid[flatIndex(normalizePosition(target))] == 0) {
                available.add(offset);
            }
        }
        if (available.isEmpty()) {
            return null;
        }
        return available.get(random.nextInt(available.size()));
    }

    @Override
    public void validatePlacement(int[] pos) {
        super.validatePlacement(pos);
        int occupant = ownerGrid[flatIndex(pos)];
        if (occupant != 0) {
            throw new IllegalStateException("Cell " + Arrays.toString(pos) + " is already occupied by agent " + occupant);
        }
    }

    @Override
    public void addAgent(PositionedAgent<int[]> agent) {
        ownerGrid[flatIndex(agent.getPos())] = agent.getId();
    }

    @Override
    public void removeAgent(PositionedAgent<int[]> agent) {
        int index = flatIndex(agent.getPos());
        if (ownerGrid[index] == agent.getId()) {
            ownerGrid[index] = 0;
        }
    }

    @Override
    public void moveAgent(PositionedAgent<int[]> agent, int[] pos) {
        checkInside(pos);
        int occupant = ownerGrid[flatIndex(pos)];
        if (occupant == agent.getId()) {
            return;
        }
        if (occupant != 0) {
            throw new IllegalStateException("Cannot move agent " + agent.getId() + " to " + Arrays.toString(pos)
                    + ": cell is occupied by agent " + occupant);
        }
        super.moveAgent(agent, pos);
    }
}
