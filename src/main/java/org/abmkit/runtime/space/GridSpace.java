package org.abmkit.runtime.space;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * Grid space in which any number of agents may share a cell.
 */
public class GridSpace extends AbstractGridSpace {

    // Lazily allocated per cell; most cells of sparse grids stay null.
    private final IntArrayList[] cells;

    public GridSpace(int[] extent, boolean periodic, Metric metric) {
        super(extent, periodic, metric);
        this.cells = new IntArrayList[cellCount];
    }

    public GridSpace(int[] extent) {
        this(extent, true, Metric.CHEBYSHEV);
    }

    @Override
    public IntList idsInPosition(int[] pos) {
        checkInside(pos);
        IntArrayList cell = cells[flatIndex(pos)];
        return cell == null ? IntLists.EMPTY_LIST : IntLists.unmodifiable(cell);
    }

    @Override
    public boolean isEmpty(int[] pos) {
        checkInside(pos);
        IntArrayList cell = cells[flatIndex(pos)];
        return cell == null || cell.isEmpty();
    }

    @Override
    public int[] chooseRandomWalkOffset(int[] pos, List<int[]> offsets, IRandomProvider random) {
        if (offsets.isEmpty()) {
            return null;
        }
        return offsets.get(random.nextInt(offsets.size()));
    }

    @Override
    public void addAgent(PositionedAgent<int[]> agent) {
        int index = flatIndex(agent.getPos());
        IntArrayList cell = cells[index];
        if (cell == null) {
            cell = new IntArrayList(2);
            cells[index] = cell;
        }
        cell.add(agent.getId());
    }

    @Override
    public void removeAgent(PositionedAgent<int[]> agent) {
        IntArrayList cell = cells[flatIndex(agent.getPos())];
        if (cell != null) {
            cell.rem(agent.getId());
        }
    }
}
