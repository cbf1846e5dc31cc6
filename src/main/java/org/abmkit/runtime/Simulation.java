package org.abmkit.runtime;

import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.space.ISpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Drives a model tick by tick. Each tick asks the model's scheduler for the ids to activate,
 * runs the agent step for each of them and runs the model step once, either before or after
 * the agents.
 */
public class Simulation<A extends Agent, S extends ISpace<?>> {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final AgentBasedModel<A, S> model;
    private final IAgentStep<A, S> agentStep;
    private final IModelStep<A, S> modelStep;
    private final boolean agentsFirst;
    private long currentTick = 0L;

    /**
     * @param model the model to drive
     * @param agentStep the per-agent rule, may be {@code null} for model-only dynamics
     * @param modelStep the model-wide rule, may be {@code null}
     * @param agentsFirst whether agents act before the model step
     */
    public Simulation(AgentBasedModel<A, S> model, IAgentStep<A, S> agentStep, IModelStep<A, S> modelStep,
                      boolean agentsFirst) {
        this.model = Objects.requireNonNull(model, "model");
        if (agentStep == null && modelStep == null) {
            throw new IllegalArgumentException("At least one of agent step and model step must be given.");
        }
        this.agentStep = agentStep;
        this.modelStep = modelStep;
        this.agentsFirst = agentsFirst;
    }

    public Simulation(AgentBasedModel<A, S> model, IAgentStep<A, S> agentStep) {
        this(model, agentStep, null, true);
    }

    public Simulation(AgentBasedModel<A, S> model, IAgentStep<A, S> agentStep, IModelStep<A, S> modelStep) {
        this(model, agentStep, modelStep, true);
    }

    /**
     * Executes a single tick. Agents removed earlier in the same tick are skipped; agents added
     * during the tick first act in the next one.
     */
    public void tick() {
        if (!agentsFirst && modelStep != null) {
            modelStep.step(model);
        }
        int activated = 0;
        if (agentStep != null) {
            IntList ids = model.schedule();
            for (int i = 0; i < ids.size(); i++) {
                A agent = model.get(ids.getInt(i));
                if (agent != null) {
                    agentStep.step(agent, model);
                    activated++;
                }
            }
        }
        if (agentsFirst && modelStep != null) {
            modelStep.step(model);
        }
        LOG.debug("Tick={} activated={} agents={}", currentTick, activated, model.count());
        currentTick++;
    }

    /**
     * Runs {@code ticks} ticks.
     */
    public void run(int ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("Tick count must be non-negative, got " + ticks);
        }
        for (int i = 0; i < ticks; i++) {
            tick();
        }
    }

    /**
     * Ticks until {@code until} returns true. The predicate is checked before every tick with
     * the number of ticks run so far.
     *
     * @return the number of ticks run by this call
     */
    public long run(BiPredicate<? super AgentBasedModel<A, S>, Long> until) {
        Objects.requireNonNull(until, "until");
        long start = currentTick;
        while (!until.test(model, currentTick)) {
            tick();
        }
        LOG.debug("Stopped after {} ticks", currentTick - start);
        return currentTick - start;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public AgentBasedModel<A, S> getModel() {
        return model;
    }
}
