package org.abmkit.runtime.space;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.spi.IRandomProvider;

/**
 * Undirected graph whose nodes, numbered {@code 1..n}, are agent positions. Any number of
 * agents may share a node.
 */
public class GraphSpace implements ISpace<Integer> {

    private final IntArrayList[] adjacency;
    private final IntArrayList[] occupants;

    /**
     * @param nodeCount number of nodes, at least 1
     */
    public GraphSpace(int nodeCount) {
        if (nodeCount <= 0) {
            throw new IllegalArgumentException("A graph space needs at least one node, got " + nodeCount);
        }
        this.adjacency = new IntArrayList[nodeCount];
        this.occupants = new IntArrayList[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            adjacency[i] = new IntArrayList();
            occupants[i] = new IntArrayList();
        }
    }

    public int getNodeCount() {
        return adjacency.length;
    }

    /**
     * Connects two nodes. Repeated edges are ignored.
     */
    public void addEdge(int a, int b) {
        checkNode(a);
        checkNode(b);
        if (!adjacency[a - 1].contains(b)) {
            adjacency[a - 1].add(b);
            if (a != b) {
                adjacency[b - 1].add(a);
            }
        }
    }

    public IntList neighbors(int node) {
        checkNode(node);
        return IntLists.unmodifiable(adjacency[node - 1]);
    }

    public IntList idsInPosition(int node) {
        checkNode(node);
        return IntLists.unmodifiable(occupants[node - 1]);
    }

    @Override
    public boolean acceptsPositionField(Class<?> fieldType) {
        return fieldType == int.class || fieldType == Integer.class;
    }

    @Override
    public String describePositionType() {
        return "int";
    }

    @Override
    public void validatePlacement(Integer pos) {
        if (pos == null) {
            throw new IllegalArgumentException("Position must not be null.");
        }
        checkNode(pos);
    }

    @Override
    public void addAgent(PositionedAgent<Integer> agent) {
        occupants[agent.getPos() - 1].add(agent.getId());
    }

    @Override
    public void removeAgent(PositionedAgent<Integer> agent) {
        occupants[agent.getPos() - 1].rem(agent.getId());
    }

    @Override
    public void moveAgent(PositionedAgent<Integer> agent, Integer pos) {
        validatePlacement(pos);
        removeAgent(agent);
        agent.setPos(pos);
        addAgent(agent);
    }

    @Override
    public Integer randomPosition(IRandomProvider random) {
        return 1 + random.nextInt(adjacency.length);
    }

    private void checkNode(int node) {
        if (node < 1 || node > adjacency.length) {
            throw new IllegalArgumentException("Node " + node + " is outside the graph of " + adjacency.length + " nodes");
        }
    }

    @Override
    public String toString() {
        return "GraphSpace with " + adjacency.length + " nodes";
    }
}
