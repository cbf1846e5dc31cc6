package org.abmkit.runtime.scheduler;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import org.abmkit.runtime.AgentBasedModel;
import org.abmkit.runtime.model.Agent;

/**
 * Activates all agents in a uniformly random order, reshuffled on every call with the
 * model's random source.
 */
public final class Randomly implements IScheduler<Agent> {

    static final Randomly INSTANCE = new Randomly();

    private Randomly() {}

    @Override
    public IntList schedule(AgentBasedModel<? extends Agent, ?> model) {
        int[] ids = model.ids().toIntArray();
        IntArrays.shuffle(ids, model.getRandomProvider().asJavaRandom());
        return IntArrayList.wrap(ids);
    }
}
