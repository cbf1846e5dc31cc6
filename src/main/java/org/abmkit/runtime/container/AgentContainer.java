package org.abmkit.runtime.container;

import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.model.Agent;

import java.util.Collection;

/**
 * Storage strategy holding all agents of a model. The variant is chosen when the model is
 * built and never changes afterwards.
 * <p>
 * Both variants iterate in their native order: insertion order for {@link MappingContainer},
 * index order for {@link SequenceContainer}. Neither performs any locking; a container is
 * owned by a single model and mutated by a single thread.
 *
 * @param <A> the agent type
 */
public sealed interface AgentContainer<A extends Agent> permits MappingContainer, SequenceContainer {

    /**
     * Stores an agent. Implementations validate before mutating, so a rejected agent leaves
     * the container unchanged.
     *
     * @param agent the agent to store
     */
    void add(A agent);

    /**
     * Removes an agent by its id.
     *
     * @param agent the agent to remove
     * @throws UnsupportedOperationException if the variant does not support removal
     */
    void remove(A agent);

    /**
     * @param id an agent id
     * @return the agent, or {@code null} if no agent has this id
     */
    A get(int id);

    boolean contains(int id);

    /**
     * @return a fresh list of all ids in native iteration order
     */
    IntList ids();

    /**
     * @return an unmodifiable view of all agents in native iteration order
     */
    Collection<A> agents();

    int size();

    /**
     * @return the id the next newly created agent should receive
     */
    int nextId();

    ContainerKind kind();
}
