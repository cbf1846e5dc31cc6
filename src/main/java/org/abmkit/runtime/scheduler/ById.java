package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;

import java.util.Arrays;

/**
 * Activates agents in ascending id order.
 */
public final class ById implements IScheduler<Agent> {

    static final ById INSTANCE = new ById();

    private ById() {}

    @Override
    public IntList schedule(AgentBasedModel<? extends Agent, ?> model) {
        int[] ids = model.ids().toIntArray();
        Arrays.sort(ids);
        return IntArrayList.wrap(ids);
    }
}
