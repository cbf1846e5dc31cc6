package org.abmkit.runtime;

import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.container.AgentContainer;
import org.abmkit.runtime.container.ContainerKind;
import org.abmkit.runtime.internal.services.SeededRandomProvider;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.model.AgentValidator;
import org.abmkit.runtime.model.ModelProperties;
import org.abmkit.runtime.model.PositionedAgent;
import org.abmkit.runtime.scheduler.IScheduler;
import org.abmkit.runtime.scheduler.Schedulers;
import org.abmkit.runtime.space.ISpace;
import org.abmkit.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * An agent-based model: a container of agents, an optional space, a scheduler, user
 * properties and a model-scoped random source.
 * <p>
 * The container variant and the space are fixed at construction. All operations are
 * synchronous and assume a single thread of control; callers that step agents in parallel
 * must serialize {@link #add}, {@link #remove} and scheduler invocations themselves.
 *
 * @param <A> the agent type, possibly a sealed union of concrete agent classes
 * @param <S> the space type
 */
public class AgentBasedModel<A extends Agent, S extends ISpace<?>> {

    private static final Logger LOG = LoggerFactory.getLogger(AgentBasedModel.class);

    private final Class<A> agentType;
    private final List<Class<? extends A>> agentTypes;
    private final AgentContainer<A> agents;
    private final S space;
    private final IScheduler<? super A> scheduler;
    private final ModelProperties properties;
    private final IRandomProvider randomProvider;

    private AgentBasedModel(Builder<A, S> builder, List<Class<? extends A>> agentTypes) {
        this.agentType = builder.agentType;
        this.agentTypes = agentTypes;
        this.agents = builder.container.create();
        this.space = builder.space;
        this.scheduler = builder.scheduler;
        this.properties = builder.properties;
        this.randomProvider = builder.randomProvider != null ? builder.randomProvider : SeededRandomProvider.unseeded();
    }

    /**
     * Starts building a model for the given agent type.
     *
     * @param agentType a concrete agent class, a sealed union, or an abstract base combined with {@link Builder#unionOf}
     * @param <A> the agent type
     * @return a builder without a space
     */
    public static <A extends Agent> Builder<A, ISpace<?>> builder(Class<A> agentType) {
        return new Builder<>(agentType);
    }

    /**
     * Starts building a model for the runtime class of an example agent.
     *
     * @param agent an example agent; it is not added to the model
     * @param <A> the agent type
     * @return a builder without a space
     */
    @SuppressWarnings("unchecked")
    public static <A extends Agent> Builder<A, ISpace<?>> builder(A agent) {
        return new Builder<>((Class<A>) agent.getClass());
    }

    /**
     * Adds an agent. The agent's position, if the model has a space, must be valid and is
     * registered with the space. Nothing is modified when the agent is rejected.
     *
     * @param agent the agent, with its id already set
     * @return the agent
     * @throws org.abmkit.runtime.api.DuplicateIdException if a mapping container already holds the id
     * @throws org.abmkit.runtime.api.IdSequenceException if a sequence container expects another id
     */
    public A add(A agent) {
        Objects.requireNonNull(agent, "agent");
        if (space != null) {
            positionedSpace().validatePlacement(positioned(agent).getPos());
        }
        agents.add(agent);
        if (space != null) {
            positionedSpace().addAgent(positioned(agent));
        }
        return agent;
    }

    /**
     * Creates an agent with {@link #nextId()} and adds it.
     *
     * @param factory receives the new id
     * @return the added agent
     */
    public A addNew(IntFunction<? extends A> factory) {
        return add(factory.apply(nextId()));
    }

    /**
     * Creates an agent with {@link #nextId()}, places it at a uniformly random position of the
     * space and adds it.
     *
     * @param factory receives the new id
     * @return the added agent
     * @throws IllegalStateException if the model has no space
     */
    @SuppressWarnings("unchecked")
    public A addNewAtRandomPosition(IntFunction<? extends A> factory) {
        ISpace<Object> s = positionedSpace();
        A agent = factory.apply(nextId());
        ((PositionedAgent<Object>) agent).setPos(s.randomPosition(randomProvider));
        return add(agent);
    }

    /**
     * Removes an agent from the container and, if present, from the space.
     *
     * @param agent the agent to remove
     * @throws IllegalArgumentException if the model does not hold this agent object under its id
     * @throws UnsupportedOperationException for sequence containers
     */
    public void remove(A agent) {
        Objects.requireNonNull(agent, "agent");
        if (agents.get(agent.getId()) != agent) {
            throw new IllegalArgumentException("Agent " + agent + " with id=" + agent.getId() + " is not part of this model.");
        }
        agents.remove(agent);
        if (space != null) {
            positionedSpace().removeAgent(positioned(agent));
        }
    }

    /**
     * Removes the agent with the given id.
     *
     * @param id the agent id
     * @throws IllegalArgumentException if no agent has this id
     * @throws UnsupportedOperationException for sequence containers
     */
    public void remove(int id) {
        A agent = agents.get(id);
        if (agent == null) {
            throw new IllegalArgumentException("No agent with id=" + id);
        }
        remove(agent);
    }

    /**
     * Moves an agent to a position of this model's space.
     *
     * @param agent the agent
     * @param pos the target, already normalized
     * @param <P> the position type
     */
    @SuppressWarnings("unchecked")
    public <P> void moveAgent(PositionedAgent<P> agent, P pos) {
        ((ISpace<P>) requireSpace()).moveAgent(agent, pos);
    }

    /**
     * @return the agent, or {@code null} if absent
     */
    public A get(int id) {
        return agents.get(id);
    }

    public boolean contains(int id) {
        return agents.contains(id);
    }

    /**
     * @return a fresh list of all ids in the container's native order
     */
    public IntList ids() {
        return agents.ids();
    }

    /**
     * @return an unmodifiable view of all agents in the container's native order
     */
    public Collection<A> agents() {
        return agents.agents();
    }

    public int count() {
        return agents.size();
    }

    /**
     * @return the id a new agent should get: one above the largest id ever added for mapping
     *         containers, {@code count() + 1} for sequence containers
     */
    public int nextId() {
        return agents.nextId();
    }

    /**
     * @return a uniformly chosen agent, or {@code null} if the model is empty
     */
    public A randomAgent() {
        IntList ids = agents.ids();
        if (ids.isEmpty()) {
            return null;
        }
        return agents.get(ids.getInt(randomProvider.nextInt(ids.size())));
    }

    /**
     * Invokes the model's scheduler.
     *
     * @return the ids to process this step
     */
    public IntList schedule() {
        return scheduler.schedule(this);
    }

    public Class<A> getAgentType() {
        return agentType;
    }

    /**
     * @return the canonical concrete member types of the agent type
     */
    public List<Class<? extends A>> getAgentTypes() {
        return agentTypes;
    }

    /**
     * @return the space, or {@code null} if the model is not spatial
     */
    public S getSpace() {
        return space;
    }

    public boolean hasSpace() {
        return space != null;
    }

    public ContainerKind getContainerKind() {
        return agents.kind();
    }

    public IScheduler<? super A> getScheduler() {
        return scheduler;
    }

    public ModelProperties getProperties() {
        return properties;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    private S requireSpace() {
        if (space == null) {
            throw new IllegalStateException("Model has no space.");
        }
        return space;
    }

    @SuppressWarnings("unchecked")
    private ISpace<Object> positionedSpace() {
        return (ISpace<Object>) requireSpace();
    }

    @SuppressWarnings("unchecked")
    private static PositionedAgent<Object> positioned(Agent agent) {
        return (PositionedAgent<Object>) agent;
    }

    @Override
    public String toString() {
        String typeName = agentTypes.size() == 1 && agentTypes.get(0) == agentType
                ? agentType.getSimpleName()
                : agentType.getSimpleName() + agentTypes.stream().map(Class::getSimpleName).toList();
        StringBuilder sb = new StringBuilder();
        sb.append(agents.kind().modelName()).append(" with ").append(count()).append(" agents of type ").append(typeName);
        if (space == null) {
            sb.append("\n space: none (no spatial structure)");
        } else {
            sb.append("\n space: ").append(space);
        }
        sb.append("\n scheduler: ").append(scheduler.name());
        if (!properties.isEmpty()) {
            sb.append("\n properties: ").append(String.join(", ", properties.keys()));
        }
        return sb.toString();
    }

    /**
     * Builder for {@link AgentBasedModel}. Defaults: no space, mapping container, fastest
     * scheduler, empty properties, an unseeded random source and warnings enabled.
     *
     * @param <A> the agent type
     * @param <S> the space type
     */
    public static final class Builder<A extends Agent, S extends ISpace<?>> {
        private final Class<A> agentType;
        private final List<Class<? extends A>> members = new ArrayList<>();
        private S space;
        private ContainerKind container = ContainerKind.MAPPING;
        private IScheduler<? super A> scheduler = Schedulers.fastest();
        private ModelProperties properties = ModelProperties.empty();
        private IRandomProvider randomProvider;
        private boolean warn = true;

        private Builder(Class<A> agentType) {
            this.agentType = Objects.requireNonNull(agentType, "agentType");
        }

        @SuppressWarnings("unchecked")
        public <T extends ISpace<?>> Builder<A, T> space(T space) {
            Builder<A, T> self = (Builder<A, T>) this;
            self.space = Objects.requireNonNull(space, "space");
            return self;
        }

        public Builder<A, S> container(ContainerKind container) {
            this.container = Objects.requireNonNull(container, "container");
            return this;
        }

        public Builder<A, S> scheduler(IScheduler<? super A> scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        public Builder<A, S> properties(ModelProperties properties) {
            this.properties = Objects.requireNonNull(properties, "properties");
            return this;
        }

        public Builder<A, S> random(IRandomProvider randomProvider) {
            this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
            return this;
        }

        public Builder<A, S> seed(long seed) {
            return random(new SeededRandomProvider(seed));
        }

        /**
         * Enables or disables advisory warnings during validation.
         */
        public Builder<A, S> warn(boolean warn) {
            this.warn = warn;
            return this;
        }

        /**
         * Declares the concrete member types of a non-sealed abstract agent type.
         */
        @SafeVarargs
        public final Builder<A, S> unionOf(Class<? extends A>... memberTypes) {
            members.addAll(Arrays.asList(memberTypes));
            return this;
        }

        /**
         * Validates the agent type against the space and builds the model.
         *
         * @return an empty model
         * @throws org.abmkit.runtime.api.SchemaException if the agent type does not fit
         */
        public AgentBasedModel<A, S> build() {
            List<Class<? extends A>> agentTypes = AgentValidator.validate(agentType, members, space, warn);
            AgentBasedModel<A, S> model = new AgentBasedModel<>(this, agentTypes);
            LOG.debug("Created {} for {} (space={}, scheduler={}, random={})",
                    container.modelName(), agentType.getSimpleName(), space, scheduler.name(), model.randomProvider);
            return model;
        }
    }
}
