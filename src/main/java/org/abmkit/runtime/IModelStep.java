package org.abmkit.runtime;

import org.abmkit.runtime.model.Agent;
import org.abmkit.runtime.space.ISpace;

/**
 * Model-wide update rule run once per tick.
 */
@FunctionalInterface
public interface IModelStep<A extends Agent, S extends ISpace<?>> {

    void step(AgentBasedModel<A, S> model);
}
