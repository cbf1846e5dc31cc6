package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;

/**
 * Activates agents in the container's native order without any reordering. The order is an
 * implementation detail of the container and may change after additions or removals.
 */
public final class Fastest implements IScheduler<Agent> {

    static final Fastest INSTANCE = new Fastest();

    private Fastest() {}

    @Override
    public IntList schedule(AgentBasedModel<? extends Agent, ?> model) {
        return model.ids();
    }
}
