package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;

/**
 * Decides which agents act in a step and in which order.
 * <p>
 * Stateless policies are plain functions of the model. Stateful schedulers own private
 * fields that they update once per invocation before deciding what to return. Either way
 * the returned list is a snapshot taken at call time; later changes to the model do not
 * affect it.
 *
 * @param <A> the most general agent type the scheduler can handle
 */
@FunctionalInterface
public interface IScheduler<A extends Agent> {

    /**
     * @param model the model to schedule
     * @return the ids to process, in order
     */
    IntList schedule(AgentBasedModel<? extends A, ?> model);

    /**
     * @return a short name used when printing models
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
