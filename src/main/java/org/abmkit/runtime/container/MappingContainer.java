package org.abmkit.runtime.container;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.api.DuplicateIdException;
import org.abmkit.runtime.model.Agent;

import java.util.Collection;
import java.util.Collections;

/**
 * Id-keyed agent storage that supports removal.
 * <p>
 * Tracks the largest id ever added. {@link #nextId()} is one above it, so ids handed out
 * through {@code nextId()} are never reused after a removal. Adding an agent that was built
 * manually with an old id is not prevented.
 *
 * @param <A> the agent type
 */
public final class MappingContainer<A extends Agent> implements AgentContainer<A> {

    private final Int2ObjectLinkedOpenHashMap<A> agentsById = new Int2ObjectLinkedOpenHashMap<>();
    private int maxId = 0;

    MappingContainer() {}

    @Override
    public void add(A agent) {
        int id = agent.getId();
        if (id <= 0) {
            throw new IllegalArgumentException("Agent ids must be positive, got " + id);
        }
        if (agentsById.containsKey(id)) {
            throw new DuplicateIdException(id);
        }
        agentsById.put(id, agent);
        if (id > maxId) {
            maxId = id;
        }
    }

    @Override
    public void remove(A agent) {
        agentsById.remove(agent.getId());
    }

    @Override
    public A get(int id) {
        return agentsById.get(id);
    }

    @Override
    public boolean contains(int id) {
        return agentsById.containsKey(id);
    }

    @Override
    public IntList ids() {
        return new IntArrayList(agentsById.keySet());
    }

    @Override
    public Collection<A> agents() {
        return Collections.unmodifiableCollection(agentsById.values());
    }

    @Override
    public int size() {
        return agentsById.size();
    }

    @Override
    public int nextId() {
        return maxId + 1;
    }

    /**
     * @return the largest id ever stored, 0 if none
     */
    public int getMaxId() {
        return maxId;
    }

    @Override
    public ContainerKind kind() {
        return ContainerKind.MAPPING;
    }
}
