package org.abmkit.runtime;

import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.space.ISpace;

/**
 * Per-agent update rule run once for every scheduled agent in a tick.
 */
@FunctionalInterface
public interface IAgentStep<A extends Agent, S extends ISpace<?>> {

    void step(A agent, AgentBasedModel<A, S> model);
}
