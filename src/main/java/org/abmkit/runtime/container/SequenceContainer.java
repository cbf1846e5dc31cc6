package org.abmkit.runtime.container;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.abmkit.runtime.api.IdSequenceException;
import org.abmkit.runtime.model.Agent;

import java.util.Collection;
import java.util.Collections;

/**
 * Dense, append-only agent storage. The agent with id {@code k} lives at index {@code k - 1},
 * which makes lookup an array access and iteration a linear scan. Removal is not supported.
 *
 * @param <A> the agent type
 */
public final class SequenceContainer<A extends Agent> implements AgentContainer<A> {

    private final ObjectArrayList<A> agents = new ObjectArrayList<>();

    SequenceContainer() {}

    @Override
    public void add(A agent) {
        int id = agent.getId();
        if (id != agents.size() + 1) {
            throw new IdSequenceException(id, agents.size());
        }
        agents.add(agent);
    }

    @Override
    public void remove(A agent) {
        throw new UnsupportedOperationException(
                "Cannot remove agents from a sequence container (agent id=" + agent.getId() + "). Use the mapping container instead.");
    }

    @Override
    public A get(int id) {
        return contains(id) ? agents.get(id - 1) : null;
    }

    @Override
    public boolean contains(int id) {
        return id >= 1 && id <= agents.size();
    }

    @Override
    public IntList ids() {
        IntArrayList ids = new IntArrayList(agents.size());
        for (int id = 1; id <= agents.size(); id++) {
            ids.add(id);
        }
        return ids;
    }

    @Override
    public Collection<A> agents() {
        return Collections.unmodifiableList(agents);
    }

    @Override
    public int size() {
        return agents.size();
    }

    @Override
    public int nextId() {
        return agents.size() + 1;
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.SEQUENCE;
    }
}
